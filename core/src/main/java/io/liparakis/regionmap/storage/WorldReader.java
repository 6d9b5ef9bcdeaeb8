package io.liparakis.regionmap.storage;

import io.liparakis.regionmap.core.ChunkPos;
import io.liparakis.regionmap.core.RegionPos;
import io.liparakis.regionmap.storage.codec.FluidCell;
import io.liparakis.regionmap.storage.codec.SectionPaletteCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static io.liparakis.regionmap.storage.RegionMapConstants.MAX_Y;
import static io.liparakis.regionmap.storage.RegionMapConstants.SECTION_SIZE;

/**
 * Entry point for reading a world's {@code chunks} directory.
 * <p>
 * Region files are named {@code <rx>.<rz>.region.bin}. Each lookup opens the
 * region read-only and closes it before returning, so nothing is cached and
 * the reader is safe to share between threads.
 */
public final class WorldReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorldReader.class);

    private final Path chunksDir;
    private final PayloadDecoder decoder;

    public WorldReader(Path chunksDir) {
        this(chunksDir, new PayloadDecoder());
    }

    public WorldReader(Path chunksDir, PayloadDecoder decoder) {
        this.chunksDir = chunksDir;
        this.decoder = decoder;
    }

    public Path regionPath(RegionPos region) {
        return chunksDir.resolve(region.fileName());
    }

    /**
     * Reads and decodes one chunk.
     *
     * @param pos the chunk's world grid position
     * @return the decoded chunk document
     * @throws ChunkNotFoundException  if the region file or the chunk is absent
     * @throws CorruptFormatException  if the region or the document layout is malformed
     * @throws CorruptPayloadException if the payload cannot be decompressed or parsed
     */
    public ChunkDocument readChunk(ChunkPos pos) throws IOException {
        Path path = regionPath(pos.region());
        try (RegionFileReader region = new RegionFileReader(path)) {
            RegionFileReader.ChunkBlob blob = region.readChunk(pos.localX(), pos.localZ());
            LOGGER.debug("Read chunk {} from {} ({} bytes compressed)",
                    pos, path.getFileName(), blob.compressed().length);
            return decoder.decode(blob);
        }
    }

    /**
     * Lists the chunks stored in a region.
     *
     * @throws ChunkNotFoundException if the region file does not exist
     */
    public List<RegionFileReader.ChunkEntry> listChunks(RegionPos region) throws IOException {
        try (RegionFileReader reader = new RegionFileReader(regionPath(region))) {
            return reader.presentChunks();
        }
    }

    /**
     * Returns the block name at world coordinates, {@code "Empty"} above or
     * below the world or where the section has no block data.
     *
     * @throws ChunkNotFoundException if the containing chunk is absent
     */
    public String blockAt(int x, int y, int z) throws IOException {
        if (y < 0 || y > MAX_Y) {
            return RegionMapConstants.EMPTY;
        }
        ChunkDocument document = readChunk(ChunkPos.ofBlock(x, z));
        Optional<SectionDocument.BlockComponent> block = document.section(y / SECTION_SIZE).block();
        if (block.isEmpty()) {
            return RegionMapConstants.EMPTY;
        }
        return SectionPaletteCodec.decodeBlockSection(block.get().data())
                .blockAt(Math.floorMod(x, SECTION_SIZE), y % SECTION_SIZE, Math.floorMod(z, SECTION_SIZE));
    }

    /**
     * Returns the fluid at world coordinates, {@link FluidCell#NONE} where there is none.
     *
     * @throws ChunkNotFoundException if the containing chunk is absent
     */
    public FluidCell fluidAt(int x, int y, int z) throws IOException {
        if (y < 0 || y > MAX_Y) {
            return FluidCell.NONE;
        }
        ChunkDocument document = readChunk(ChunkPos.ofBlock(x, z));
        Optional<SectionDocument.FluidComponent> fluid = document.section(y / SECTION_SIZE).fluid();
        if (fluid.isEmpty()) {
            return FluidCell.NONE;
        }
        return SectionPaletteCodec.decodeFluidSection(fluid.get().data())
                .fluidAt(Math.floorMod(x, SECTION_SIZE), y % SECTION_SIZE, Math.floorMod(z, SECTION_SIZE));
    }
}
