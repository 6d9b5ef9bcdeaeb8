package io.liparakis.regionmap.storage;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.liparakis.regionmap.storage.RegionMapConstants.BLOB_PREFIX_SIZE;
import static io.liparakis.regionmap.storage.RegionMapConstants.HEADER_LENGTH;
import static io.liparakis.regionmap.storage.RegionMapConstants.LOCATION_ENTRY_SIZE;
import static io.liparakis.regionmap.storage.RegionMapConstants.LOCATION_TABLE_ENTRIES;
import static io.liparakis.regionmap.storage.RegionMapConstants.REGION_WIDTH_CHUNKS;

/**
 * Read-only handle on a region file holding up to 32x32 compressed chunks.
 * <p>
 * Format (all integers big-endian):
 * <pre>
 * 0x00  20  magic
 * 0x14   4  version
 * 0x18   4  blob count
 * 0x1C   4  segment size
 * 0x20  4096  location table, 1024 segment indices, entry = x + z * 32, 0 = absent
 * </pre>
 * Segment {@code n} starts at {@code n * segmentSize + 32} with an
 * {uncompressedSize, compressedSize} prefix followed by the compressed bytes.
 */
public final class RegionFileReader implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegionFileReader.class);

    private final Path path;
    private final FileChannel channel;
    private final Header header;
    private final long[] segments = new long[LOCATION_TABLE_ENTRIES];

    /**
     * Opens a region file and loads its header and location table.
     *
     * @param path the region file
     * @throws ChunkNotFoundException if the file does not exist
     * @throws CorruptFormatException if the header is truncated or the magic does not match
     * @throws IOException            if the file cannot be read
     */
    public RegionFileReader(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new ChunkNotFoundException("Region file does not exist: " + path);
        }
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            this.header = loadHeader();
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    /**
     * Reads the fixed header and the location table.
     */
    private Header loadHeader() throws IOException {
        int tableBytes = LOCATION_TABLE_ENTRIES * LOCATION_ENTRY_SIZE;
        byte[] raw = readFully(0, HEADER_LENGTH + tableBytes);
        ByteCursor cursor = new ByteCursor(raw);

        byte[] magic = cursor.readBytes("region magic", RegionMapConstants.MAGIC_BYTES.length);
        if (!Arrays.equals(magic, RegionMapConstants.MAGIC_BYTES)) {
            throw new CorruptFormatException(String.format(
                    "Invalid region magic in %s: '%s' (expected: '%s')",
                    path, printable(magic), RegionMapConstants.MAGIC));
        }

        long version = cursor.readU32BE("region version");
        long blobCount = cursor.readU32BE("region blob count");
        long segmentSize = cursor.readU32BE("region segment size");

        for (int i = 0; i < LOCATION_TABLE_ENTRIES; i++) {
            segments[i] = cursor.readU32BE("location table entry " + i);
        }

        LOGGER.debug("Opened region {}: version={}, blobs={}, segmentSize={}",
                path.getFileName(), version, blobCount, segmentSize);
        return new Header(RegionMapConstants.MAGIC, version, blobCount, segmentSize);
    }

    public Header header() {
        return header;
    }

    /**
     * Looks up the segment index of a chunk.
     *
     * @param relativeX chunk X within the region (0-31)
     * @param relativeZ chunk Z within the region (0-31)
     * @return the non-zero segment index
     * @throws ChunkNotFoundException if the chunk is not stored
     */
    public long locateChunk(int relativeX, int relativeZ) throws ChunkNotFoundException {
        long segment = segments[tableIndex(relativeX, relativeZ)];
        if (segment == 0) {
            throw new ChunkNotFoundException(String.format(
                    "Chunk (%d, %d) not present in %s", relativeX, relativeZ, path.getFileName()));
        }
        return segment;
    }

    /**
     * Reads the compressed blob stored at a segment.
     *
     * @param segmentIndex the segment index from the location table
     * @return the size hint and the compressed bytes
     * @throws CorruptFormatException if the file ends before the declared length
     */
    public ChunkBlob readChunkBlob(long segmentIndex) throws IOException {
        long location = segmentIndex * header.segmentSize() + HEADER_LENGTH;

        ByteCursor prefix = new ByteCursor(readFully(location, BLOB_PREFIX_SIZE));
        int uncompressedSize = prefix.readLengthBE("uncompressed size");
        int compressedSize = prefix.readLengthBE("compressed size");

        LOGGER.debug("Segment {} at offset {}: uncompressed={} compressed={}",
                segmentIndex, location, uncompressedSize, compressedSize);

        long dataStart = location + BLOB_PREFIX_SIZE;
        long available = Math.max(0, channel.size() - dataStart);
        if (compressedSize > available) {
            throw new CorruptFormatException(
                    "chunk blob in " + path.getFileName(),
                    (int) Math.min(dataStart, Integer.MAX_VALUE), compressedSize, (int) available);
        }

        byte[] compressed = readFully(dataStart, compressedSize);
        return new ChunkBlob(uncompressedSize, compressed);
    }

    /**
     * Locates and reads a chunk blob.
     */
    public ChunkBlob readChunk(int relativeX, int relativeZ) throws IOException {
        return readChunkBlob(locateChunk(relativeX, relativeZ));
    }

    /**
     * Lists all chunks present in this region, in location table order.
     */
    public List<ChunkEntry> presentChunks() {
        List<ChunkEntry> chunks = new ArrayList<>();
        for (int i = 0; i < LOCATION_TABLE_ENTRIES; i++) {
            if (segments[i] != 0) {
                chunks.add(new ChunkEntry(i % REGION_WIDTH_CHUNKS, i / REGION_WIDTH_CHUNKS, segments[i]));
            }
        }
        return chunks;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private static int tableIndex(int relativeX, int relativeZ) {
        if (relativeX < 0 || relativeX >= REGION_WIDTH_CHUNKS || relativeZ < 0 || relativeZ >= REGION_WIDTH_CHUNKS) {
            throw new IllegalArgumentException(String.format(
                    "Chunk (%d, %d) outside region bounds", relativeX, relativeZ));
        }
        return relativeX + relativeZ * REGION_WIDTH_CHUNKS;
    }

    /**
     * Reads exactly {@code length} bytes at {@code position}.
     *
     * @throws CorruptFormatException if the file ends first
     */
    private byte[] readFully(long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        long cursor = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, cursor);
            if (read < 0) {
                break;
            }
            cursor += read;
        }
        if (buffer.hasRemaining()) {
            throw new CorruptFormatException(
                    "region data in " + path.getFileName(),
                    (int) Math.min(position, Integer.MAX_VALUE), length, buffer.position());
        }
        return buffer.array();
    }

    private static String printable(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            sb.append(b >= 0x20 && b < 0x7F ? (char) b : '.');
        }
        return sb.toString();
    }

    /**
     * The fixed region header.
     */
    public record Header(String magic, long version, long blobCount, long segmentSize) {
    }

    /**
     * A compressed chunk blob.
     *
     * @param uncompressedSizeHint the declared size after decompression
     * @param compressed           the compressed bytes
     */
    public record ChunkBlob(int uncompressedSizeHint, byte[] compressed) {
    }

    /**
     * An occupied location table entry.
     */
    public record ChunkEntry(int localX, int localZ, long segment) {
        @Override
        public @NotNull String toString() {
            return String.format("Chunk [%d, %d] (segment %d)", localX, localZ, segment);
        }
    }
}
