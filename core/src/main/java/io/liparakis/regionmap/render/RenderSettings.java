package io.liparakis.regionmap.render;

/**
 * Render options.
 *
 * @param pixelsPerBlock side of the square each block occupies in the output, at least 1
 * @param threads        number of chunks rendered in parallel by a map render, at least 1
 */
public record RenderSettings(int pixelsPerBlock, int threads) {
    public static final int DEFAULT_PIXELS_PER_BLOCK = 1;
    public static final int DEFAULT_THREADS = 1;

    public RenderSettings {
        if (pixelsPerBlock < 1) {
            throw new IllegalArgumentException("pixelsPerBlock must be at least 1, got " + pixelsPerBlock);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
    }

    public static RenderSettings defaults() {
        return new RenderSettings(DEFAULT_PIXELS_PER_BLOCK, DEFAULT_THREADS);
    }

    public RenderSettings withPixelsPerBlock(int pixelsPerBlock) {
        return new RenderSettings(pixelsPerBlock, threads);
    }

    public RenderSettings withThreads(int threads) {
        return new RenderSettings(pixelsPerBlock, threads);
    }
}
