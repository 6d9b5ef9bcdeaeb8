package io.liparakis.regionmap.tool;

import io.liparakis.regionmap.render.RgbRaster;
import io.liparakis.regionmap.spi.ImageSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rasters as 24-bit PNG files.
 */
public final class PngImageSink implements ImageSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(PngImageSink.class);

    @Override
    public void write(RgbRaster raster, Path target) throws IOException {
        BufferedImage image = new BufferedImage(raster.width(), raster.height(), BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, raster.width(), raster.height(), raster.pixels(), 0, raster.width());

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("No PNG writer available for " + target);
        }
        LOGGER.info("Saved {} ({}x{})", target, raster.width(), raster.height());
    }
}
