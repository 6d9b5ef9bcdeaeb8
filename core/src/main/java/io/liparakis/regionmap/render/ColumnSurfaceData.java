package io.liparakis.regionmap.render;

/**
 * Surface of every column in a chunk. All grids are indexed {@code [z][x]}.
 */
public final class ColumnSurfaceData {
    private final int[][] heights;
    private final String[][] blockNames;
    private final FluidColumn[][] fluids;

    ColumnSurfaceData(int[][] heights, String[][] blockNames, FluidColumn[][] fluids) {
        this.heights = heights;
        this.blockNames = blockNames;
        this.fluids = fluids;
    }

    public int heightAt(int x, int z) {
        return heights[z][x];
    }

    public String blockAt(int x, int z) {
        return blockNames[z][x];
    }

    public FluidColumn fluidAt(int x, int z) {
        return fluids[z][x];
    }

    /**
     * @return the backing height grid, indexed {@code [z][x]}; do not modify
     */
    int[][] heights() {
        return heights;
    }
}
