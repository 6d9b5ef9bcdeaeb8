package io.liparakis.regionmap.render;

import io.liparakis.regionmap.storage.ChunkDocument;
import io.liparakis.regionmap.storage.CorruptFormatException;
import io.liparakis.regionmap.storage.codec.BlockChunkData;
import io.liparakis.regionmap.storage.codec.BlockChunkDataDecoder;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

import static io.liparakis.regionmap.storage.RegionMapConstants.SECTION_SIZE;

/**
 * Renders one decoded chunk as a top-down image.
 * <p>
 * Every block column becomes a {@code p x p} square, {@code p} being
 * {@link RenderSettings#pixelsPerBlock()}. Each pixel of the square is shaded
 * at its own sub-cell position so slopes read smoothly at higher scales.
 * Stateless apart from the compositor's colour cache; safe to share between
 * threads.
 */
public final class ChunkRenderer {
    private final Compositor compositor;
    private final RenderSettings settings;

    public ChunkRenderer(Compositor compositor, RenderSettings settings) {
        this.compositor = compositor;
        this.settings = settings;
    }

    public RenderSettings settings() {
        return settings;
    }

    /**
     * @return side length in pixels of one rendered chunk
     */
    public int chunkPixels() {
        return SECTION_SIZE * settings.pixelsPerBlock();
    }

    /**
     * Renders a chunk into a new raster.
     *
     * @throws CorruptFormatException if a block section or the column blob is malformed
     */
    public RgbRaster render(ChunkDocument document) throws CorruptFormatException {
        RgbRaster raster = new RgbRaster(chunkPixels(), chunkPixels());
        renderInto(raster, 0, 0, document);
        return raster;
    }

    /**
     * Renders a chunk into part of an existing raster.
     *
     * @param raster  destination
     * @param offsetX pixel X of the chunk's north-west corner
     * @param offsetY pixel Y of the chunk's north-west corner
     * @throws CorruptFormatException if a block section or the column blob is malformed
     */
    public void renderInto(RgbRaster raster, int offsetX, int offsetY, ChunkDocument document)
            throws CorruptFormatException {
        ColumnSurfaceData surface = new SurfaceExtractor(document).extract();
        BlockChunkData columns = decodeColumns(document);
        int[][] heights = surface.heights();
        int scale = settings.pixelsPerBlock();

        for (int z = 0; z < SECTION_SIZE; z++) {
            for (int x = 0; x < SECTION_SIZE; x++) {
                int height = surface.heightAt(x, z);
                Neighborhood neighborhood = Neighborhood.of(heights, x, z);
                String blockName = surface.blockAt(x, z);
                Integer biomeTint = columns == null ? null : columns.tintAt(x, z);
                FluidColumn fluid = surface.fluidAt(x, z);

                for (int pz = 0; pz < scale; pz++) {
                    double v = (pz + 0.5) / scale;
                    for (int px = 0; px < scale; px++) {
                        double u = (px + 0.5) / scale;
                        double shade = Shader.shade(height, neighborhood, u, v);
                        int rgb = compositor.composite(blockName, biomeTint, shade, fluid);
                        raster.set(offsetX + x * scale + px, offsetY + z * scale + pz, rgb);
                    }
                }
            }
        }
    }

    /**
     * Biome tints are optional; a present but malformed column blob fails the chunk.
     */
    private static @Nullable BlockChunkData decodeColumns(ChunkDocument document) throws CorruptFormatException {
        Optional<byte[]> blob = document.blockChunkData();
        if (blob.isEmpty()) {
            return null;
        }
        return BlockChunkDataDecoder.decode(blob.get());
    }
}
