package io.liparakis.regionmap.tool;

import io.liparakis.regionmap.render.RgbRaster;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PngImageSink}.
 */
class PngImageSinkTest {

    @TempDir
    Path dir;

    @Test
    void write_createsParentDirectoriesAndKeepsPixels() throws IOException {
        RgbRaster raster = new RgbRaster(3, 2);
        raster.set(0, 0, 0xFF0000);
        raster.set(2, 1, 0x123456);
        Path target = dir.resolve("maps").resolve("out.png");

        new PngImageSink().write(raster, target);

        BufferedImage image = ImageIO.read(target.toFile());
        assertThat(image.getWidth()).isEqualTo(3);
        assertThat(image.getHeight()).isEqualTo(2);
        assertThat(image.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0xFF0000);
        assertThat(image.getRGB(2, 1) & 0xFFFFFF).isEqualTo(0x123456);
        assertThat(image.getRGB(1, 0) & 0xFFFFFF).isZero();
    }
}
