package io.liparakis.regionmap.storage;

import com.github.luben.zstd.ZstdInputStream;
import org.bson.BSONException;
import org.bson.BsonArray;
import org.bson.BsonBinaryReader;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.DecoderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a compressed chunk blob into a {@link ChunkDocument}.
 * <p>
 * The blob is a Zstandard frame wrapping a BSON document. The BSON tree is
 * checked against the expected layout here, so later stages see typed
 * sections instead of arbitrary nested maps:
 * <pre>
 * Components.ChunkColumn.Sections[10]
 *     Components.Block { Version: int, Data: binary }   (optional)
 *     Components.Fluid { Data: binary }                 (optional)
 * Components.BlockChunk { Data: binary }                (optional)
 * </pre>
 * Stateless and safe to share.
 */
public final class PayloadDecoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(PayloadDecoder.class);

    private static final String COMPONENTS = "Components";
    private static final String CHUNK_COLUMN = "ChunkColumn";
    private static final String SECTIONS = "Sections";
    private static final String BLOCK = "Block";
    private static final String FLUID = "Fluid";
    private static final String BLOCK_CHUNK = "BlockChunk";
    private static final String VERSION = "Version";
    private static final String DATA = "Data";

    private static final BsonDocumentCodec DOCUMENT_CODEC = new BsonDocumentCodec();

    /**
     * Decompresses and decodes a chunk blob.
     *
     * @param compressed the compressed payload
     * @return the typed chunk document
     * @throws CorruptPayloadException if decompression or BSON decoding fails
     * @throws CorruptFormatException  if the document does not have the expected layout
     */
    public ChunkDocument decode(byte[] compressed) throws IOException {
        byte[] raw = decompress(compressed);
        return toChunkDocument(parseDocument(raw));
    }

    /**
     * Decodes a blob read from a region, checking the declared size.
     */
    public ChunkDocument decode(RegionFileReader.ChunkBlob blob) throws IOException {
        byte[] raw = decompress(blob.compressed());
        if (raw.length != blob.uncompressedSizeHint()) {
            LOGGER.debug("Decompressed {} bytes, header declared {}", raw.length, blob.uncompressedSizeHint());
        }
        return toChunkDocument(parseDocument(raw));
    }

    /**
     * Decompresses a Zstandard frame.
     *
     * @throws CorruptPayloadException if the frame is invalid or truncated
     */
    public byte[] decompress(byte[] compressed) throws CorruptPayloadException {
        try (InputStream in = new ZstdInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new CorruptPayloadException("Failed to decompress chunk payload: " + e.getMessage(), e);
        }
    }

    /**
     * Parses raw BSON into the generic document tree.
     *
     * @throws CorruptPayloadException if the bytes are not a valid BSON document
     */
    public BsonDocument parseDocument(byte[] raw) throws CorruptPayloadException {
        try (BsonBinaryReader reader = new BsonBinaryReader(ByteBuffer.wrap(raw))) {
            return DOCUMENT_CODEC.decode(reader, DecoderContext.builder().build());
        } catch (BSONException | IllegalStateException | IllegalArgumentException e) {
            throw new CorruptPayloadException("Failed to decode chunk document: " + e.getMessage(), e);
        }
    }

    /**
     * Maps the generic document tree onto the typed chunk model.
     *
     * @throws CorruptFormatException if a required entry is missing or has the wrong type
     */
    public ChunkDocument toChunkDocument(BsonDocument root) throws CorruptFormatException {
        BsonDocument components = requireDocument(root, COMPONENTS, "chunk");
        BsonDocument column = requireDocument(components, CHUNK_COLUMN, COMPONENTS);
        BsonValue sectionsValue = column.get(SECTIONS);
        if (sectionsValue == null || !sectionsValue.isArray()) {
            throw new CorruptFormatException("Missing or invalid Components.ChunkColumn.Sections array");
        }

        BsonArray array = sectionsValue.asArray();
        if (array.size() != RegionMapConstants.SECTIONS_PER_CHUNK) {
            throw new CorruptFormatException(String.format(
                    "Invalid section count: %d (expected: %d)", array.size(), RegionMapConstants.SECTIONS_PER_CHUNK));
        }

        List<SectionDocument> sections = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            BsonValue value = array.get(i);
            if (!value.isDocument()) {
                throw new CorruptFormatException("Section " + i + " is not a document: " + value.getBsonType());
            }
            sections.add(toSection(value.asDocument(), i));
        }

        byte[] blockChunk = null;
        BsonValue blockChunkValue = components.get(BLOCK_CHUNK);
        if (blockChunkValue != null) {
            if (!blockChunkValue.isDocument()) {
                throw new CorruptFormatException("Components.BlockChunk is not a document");
            }
            blockChunk = requireBinary(blockChunkValue.asDocument(), DATA, BLOCK_CHUNK);
        }

        return new ChunkDocument(sections, blockChunk);
    }

    private static SectionDocument toSection(BsonDocument section, int index) throws CorruptFormatException {
        BsonValue componentsValue = section.get(COMPONENTS);
        if (componentsValue == null) {
            return SectionDocument.empty();
        }
        if (!componentsValue.isDocument()) {
            throw new CorruptFormatException("Section " + index + " Components is not a document");
        }
        BsonDocument components = componentsValue.asDocument();
        String where = "section " + index;

        SectionDocument.BlockComponent block = null;
        BsonValue blockValue = components.get(BLOCK);
        if (blockValue != null) {
            if (!blockValue.isDocument()) {
                throw new CorruptFormatException("Block component of " + where + " is not a document");
            }
            BsonDocument blockDoc = blockValue.asDocument();
            BsonValue version = blockDoc.get(VERSION);
            if (version != null && !version.isNumber()) {
                throw new CorruptFormatException("Block version of " + where + " is not a number");
            }
            block = new SectionDocument.BlockComponent(
                    version == null ? 0 : version.asNumber().intValue(),
                    requireBinary(blockDoc, DATA, where));
        }

        SectionDocument.FluidComponent fluid = null;
        BsonValue fluidValue = components.get(FLUID);
        if (fluidValue != null) {
            if (!fluidValue.isDocument()) {
                throw new CorruptFormatException("Fluid component of " + where + " is not a document");
            }
            fluid = new SectionDocument.FluidComponent(requireBinary(fluidValue.asDocument(), DATA, where));
        }

        return new SectionDocument(block, fluid);
    }

    private static BsonDocument requireDocument(BsonDocument parent, String key, String where)
            throws CorruptFormatException {
        BsonValue value = parent.get(key);
        if (value == null || !value.isDocument()) {
            throw new CorruptFormatException("Missing or invalid " + key + " in " + where);
        }
        return value.asDocument();
    }

    private static byte[] requireBinary(BsonDocument parent, String key, String where)
            throws CorruptFormatException {
        BsonValue value = parent.get(key);
        if (value == null || !value.isBinary()) {
            throw new CorruptFormatException("Missing or invalid binary " + key + " in " + where);
        }
        return value.asBinary().getData();
    }
}
