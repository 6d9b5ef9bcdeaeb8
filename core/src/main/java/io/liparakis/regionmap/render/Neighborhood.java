package io.liparakis.regionmap.render;

/**
 * Heights of the eight columns around a centre column. North is -Z, west is -X.
 */
public record Neighborhood(int n, int s, int w, int e, int nw, int ne, int sw, int se) {

    /**
     * A neighbourhood where every neighbour has the same height.
     */
    public static Neighborhood flat(int height) {
        return new Neighborhood(height, height, height, height, height, height, height, height);
    }

    /**
     * Reads the neighbours of {@code (x, z)} from a {@code [z][x]} grid.
     * Neighbours outside the grid take the centre height.
     */
    public static Neighborhood of(int[][] heights, int x, int z) {
        int center = heights[z][x];
        return new Neighborhood(
                sample(heights, x, z - 1, center),
                sample(heights, x, z + 1, center),
                sample(heights, x - 1, z, center),
                sample(heights, x + 1, z, center),
                sample(heights, x - 1, z - 1, center),
                sample(heights, x + 1, z - 1, center),
                sample(heights, x - 1, z + 1, center),
                sample(heights, x + 1, z + 1, center));
    }

    private static int sample(int[][] heights, int x, int z, int fallback) {
        if (z < 0 || z >= heights.length || x < 0 || x >= heights[z].length) {
            return fallback;
        }
        return heights[z][x];
    }
}
