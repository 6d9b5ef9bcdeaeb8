package io.liparakis.regionmap.spi;

import io.liparakis.regionmap.render.RgbRaster;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists rendered rasters. Implementations choose the image format.
 */
public interface ImageSink {

    /**
     * Writes a raster to a file, replacing any existing file.
     *
     * @param raster the pixels to write
     * @param target the output file
     * @throws IOException if the image cannot be encoded or written
     */
    void write(RgbRaster raster, Path target) throws IOException;
}
