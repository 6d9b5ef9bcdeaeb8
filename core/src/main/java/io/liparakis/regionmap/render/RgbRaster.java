package io.liparakis.regionmap.render;

/**
 * A width x height grid of packed {@code 0xRRGGBB} pixels, initially black.
 * <p>
 * Concurrent writers are safe as long as they touch disjoint pixels.
 */
public final class RgbRaster {
    private final int width;
    private final int height;
    private final int[] pixels;

    public RgbRaster(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(String.format("Invalid raster size %dx%d", width, height));
        }
        this.width = width;
        this.height = height;
        this.pixels = new int[width * height];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int get(int x, int y) {
        return pixels[index(x, y)];
    }

    public void set(int x, int y, int rgb) {
        pixels[index(x, y)] = rgb & 0xFFFFFF;
    }

    /**
     * @return the backing row-major pixel array; do not modify
     */
    public int[] pixels() {
        return pixels;
    }

    private int index(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException(String.format(
                    "Pixel (%d, %d) outside %dx%d raster", x, y, width, height));
        }
        return y * width + x;
    }
}
