package io.liparakis.regionmap.core;

import io.liparakis.regionmap.storage.RegionMapConstants;
import org.jetbrains.annotations.NotNull;

/**
 * Chunk coordinates in the world grid. One chunk covers 32x32 world columns.
 *
 * @param x the chunk X coordinate
 * @param z the chunk Z coordinate
 */
public record ChunkPos(int x, int z) {

    /**
     * Returns the chunk containing the given world column.
     */
    public static ChunkPos ofBlock(int blockX, int blockZ) {
        return new ChunkPos(
                Math.floorDiv(blockX, RegionMapConstants.SECTION_SIZE),
                Math.floorDiv(blockZ, RegionMapConstants.SECTION_SIZE));
    }

    public RegionPos region() {
        return new RegionPos(
                Math.floorDiv(x, RegionMapConstants.REGION_WIDTH_CHUNKS),
                Math.floorDiv(z, RegionMapConstants.REGION_WIDTH_CHUNKS));
    }

    /**
     * @return X position within the region (0-31)
     */
    public int localX() {
        return Math.floorMod(x, RegionMapConstants.REGION_WIDTH_CHUNKS);
    }

    /**
     * @return Z position within the region (0-31)
     */
    public int localZ() {
        return Math.floorMod(z, RegionMapConstants.REGION_WIDTH_CHUNKS);
    }

    @Override
    public @NotNull String toString() {
        return "[" + x + ", " + z + "]";
    }
}
