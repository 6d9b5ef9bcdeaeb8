package io.liparakis.regionmap.storage.codec;

import io.liparakis.regionmap.storage.RegionMapConstants;

/**
 * Per-chunk column data: physics flag, heightmap and biome tint.
 * Grids are indexed {@code [z][x]}.
 */
public final class BlockChunkData {
    private final boolean needsPhysics;
    private final int[][] heights;
    private final int[][] tints;

    BlockChunkData(boolean needsPhysics, int[][] heights, int[][] tints) {
        this.needsPhysics = needsPhysics;
        this.heights = heights;
        this.tints = tints;
    }

    public boolean needsPhysics() {
        return needsPhysics;
    }

    /**
     * @return the stored height of a column, 0 when its index is outside the palette
     */
    public int heightAt(int x, int z) {
        return heights[z & 31][x & 31];
    }

    /**
     * @return the biome tint of a column as {@code 0xRRGGBB}, white when outside the palette
     */
    public int tintAt(int x, int z) {
        return tints[z & 31][x & 31];
    }

    static int[][] emptyGrid() {
        return new int[RegionMapConstants.SECTION_SIZE][RegionMapConstants.SECTION_SIZE];
    }
}
