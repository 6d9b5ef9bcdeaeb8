package io.liparakis.regionmap.render;

import io.liparakis.regionmap.core.ChunkPos;
import io.liparakis.regionmap.storage.ChunkDocument;
import io.liparakis.regionmap.storage.ChunkNotFoundException;
import io.liparakis.regionmap.storage.WorldReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders a rectangle of chunks into one raster.
 * <p>
 * Chunks are tiled in grid order, {@code startX, startZ} at the top-left.
 * Chunks that are absent or fail to decode are skipped and stay black; a
 * single bad chunk never aborts the render. With more than one thread, chunks
 * are rendered in parallel. Each chunk writes only its own tile, so the output
 * does not depend on scheduling.
 */
public final class MapRenderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(MapRenderer.class);

    private final WorldReader world;
    private final ChunkRenderer chunkRenderer;

    public MapRenderer(WorldReader world, ChunkRenderer chunkRenderer) {
        this.world = world;
        this.chunkRenderer = chunkRenderer;
    }

    /**
     * Renders all chunks in the range.
     *
     * @param range inclusive chunk range
     * @return the map, {@code 32 * pixelsPerBlock} pixels per chunk
     */
    public MapResult render(ChunkRange range) {
        int tile = chunkRenderer.chunkPixels();
        RgbRaster raster = new RgbRaster(range.widthChunks() * tile, range.heightChunks() * tile);
        AtomicInteger rendered = new AtomicInteger();
        List<ChunkPos> chunks = range.chunks();
        int threads = chunkRenderer.settings().threads();

        LOGGER.info("Rendering {}x{} chunks ({} total) from {} on {} thread(s)",
                range.widthChunks(), range.heightChunks(), range.size(), range, threads);

        if (threads <= 1) {
            for (ChunkPos pos : chunks) {
                if (renderTile(raster, range, pos)) {
                    rendered.incrementAndGet();
                }
            }
        } else {
            renderParallel(raster, range, chunks, threads, rendered);
        }

        LOGGER.info("Rendered {} of {} chunks ({}x{} pixels)",
                rendered.get(), range.size(), raster.width(), raster.height());
        return new MapResult(raster, rendered.get(), range.size() - rendered.get());
    }

    private void renderParallel(RgbRaster raster, ChunkRange range, List<ChunkPos> chunks,
                                int threads, AtomicInteger rendered) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Boolean>> futures = new ArrayList<>(chunks.size());
            for (ChunkPos pos : chunks) {
                futures.add(executor.submit(() -> renderTile(raster, range, pos)));
            }
            for (Future<Boolean> future : futures) {
                if (future.get()) {
                    rendered.incrementAndGet();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Map render interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Chunk render failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * @return whether the chunk was drawn
     */
    private boolean renderTile(RgbRaster raster, ChunkRange range, ChunkPos pos) {
        int tile = chunkRenderer.chunkPixels();
        try {
            ChunkDocument document = world.readChunk(pos);
            chunkRenderer.renderInto(raster,
                    (pos.x() - range.startX()) * tile,
                    (pos.z() - range.startZ()) * tile,
                    document);
            LOGGER.debug("Rendered chunk {}", pos);
            return true;
        } catch (ChunkNotFoundException e) {
            LOGGER.info("Chunk {} not found, skipping: {}", pos, e.getMessage());
            return false;
        } catch (IOException e) {
            LOGGER.warn("Failed to decode chunk {}, skipping", pos, e);
            return false;
        }
    }

    /**
     * Outcome of a map render.
     *
     * @param raster   the rendered map
     * @param rendered chunks drawn
     * @param skipped  chunks absent or undecodable
     */
    public record MapResult(RgbRaster raster, int rendered, int skipped) {
    }
}
