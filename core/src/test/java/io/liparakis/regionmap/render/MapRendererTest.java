package io.liparakis.regionmap.render;

import io.liparakis.regionmap.ChunkFixtures;
import io.liparakis.regionmap.core.ChunkPos;
import io.liparakis.regionmap.storage.ChunkDocument;
import io.liparakis.regionmap.storage.ChunkNotFoundException;
import io.liparakis.regionmap.storage.CorruptFormatException;
import io.liparakis.regionmap.storage.CorruptPayloadException;
import io.liparakis.regionmap.storage.PayloadDecoder;
import io.liparakis.regionmap.storage.WorldReader;
import io.liparakis.regionmap.storage.codec.PaletteEncoding;
import org.bson.BsonDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link MapRenderer} with a mocked world, and with region files on disk.
 */
@ExtendWith(MockitoExtension.class)
class MapRendererTest {

    @Mock
    private WorldReader world;

    @TempDir
    Path chunksDir;

    private BsonDocument sandDocument;
    private ChunkDocument sandChunk;

    @BeforeEach
    void setUp() throws Exception {
        sandDocument = ChunkFixtures.singleSectionChunk(
                ChunkFixtures.blockSection(PaletteEncoding.BYTE, new String[] {"Sand"},
                        ChunkFixtures.filledByteArray(0)));
        sandChunk = new PayloadDecoder().toChunkDocument(sandDocument);
    }

    private static MapRenderer renderer(WorldReader world, RenderSettings settings) {
        return new MapRenderer(world, new ChunkRenderer(new Compositor(BlockDisplayProperties.empty()), settings));
    }

    @Test
    void render_tilesChunksInGridOrder() throws Exception {
        when(world.readChunk(any(ChunkPos.class))).thenThrow(new ChunkNotFoundException("absent"));
        lenient().doReturn(sandChunk).when(world).readChunk(new ChunkPos(1, -1));

        MapRenderer.MapResult result = renderer(world, RenderSettings.defaults())
                .render(new ChunkRange(0, -1, 1, 0));

        RgbRaster raster = result.raster();
        assertThat(raster.width()).isEqualTo(64);
        assertThat(raster.height()).isEqualTo(64);
        assertThat(result.rendered()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(3);
        // (1, -1) is the top-right tile
        assertThat(raster.get(32, 0)).isNotEqualTo(Rgb.BLACK);
        assertThat(raster.get(63, 31)).isNotEqualTo(Rgb.BLACK);
        assertThat(raster.get(0, 0)).isEqualTo(Rgb.BLACK);
        assertThat(raster.get(32, 32)).isEqualTo(Rgb.BLACK);
    }

    @Test
    void render_corruptChunksAreSkipped() throws Exception {
        when(world.readChunk(new ChunkPos(0, 0))).thenReturn(sandChunk);
        when(world.readChunk(new ChunkPos(1, 0))).thenThrow(new CorruptFormatException("bad magic"));
        when(world.readChunk(new ChunkPos(2, 0))).thenThrow(new CorruptPayloadException("bad zstd", null));

        MapRenderer.MapResult result = renderer(world, RenderSettings.defaults())
                .render(new ChunkRange(0, 0, 2, 0));

        assertThat(result.rendered()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(2);
        assertThat(result.raster().get(0, 0)).isNotEqualTo(Rgb.BLACK);
        assertThat(result.raster().get(40, 0)).isEqualTo(Rgb.BLACK);
    }

    @Test
    void render_truncatedColumnBlob_skipsChunk() throws Exception {
        byte[][] blocks = new byte[10][];
        blocks[0] = ChunkFixtures.blockSection(PaletteEncoding.BYTE, new String[] {"Sand"},
                ChunkFixtures.filledByteArray(0));
        ChunkDocument truncated = new PayloadDecoder().toChunkDocument(
                ChunkFixtures.chunkDocument(blocks, null, new byte[] {1, 2}));
        when(world.readChunk(new ChunkPos(0, 0))).thenReturn(sandChunk);
        when(world.readChunk(new ChunkPos(1, 0))).thenReturn(truncated);

        MapRenderer.MapResult result = renderer(world, RenderSettings.defaults())
                .render(new ChunkRange(0, 0, 1, 0));

        assertThat(result.rendered()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.raster().get(40, 5)).isEqualTo(Rgb.BLACK);
    }

    @Test
    void render_regionBlobWithOversizedLength_skipsChunk() throws Exception {
        // chunk (-1, 0) sits at local (31, 0) of region -1.0; chunk (0, 0) declares more bytes than the file holds
        ChunkFixtures.writeRegionWithDocuments(chunksDir.resolve("-1.0.region.bin"), Map.of(31, sandDocument));
        ChunkFixtures.writeRegionWithDeclaredSize(chunksDir.resolve("0.0.region.bin"),
                Integer.MAX_VALUE, new byte[10]);

        MapRenderer.MapResult result = renderer(new WorldReader(chunksDir), RenderSettings.defaults())
                .render(new ChunkRange(-1, 0, 0, 0));

        assertThat(result.rendered()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.raster().get(5, 5)).isNotEqualTo(Rgb.BLACK);
        assertThat(result.raster().get(40, 5)).isEqualTo(Rgb.BLACK);
    }

    @Test
    void render_parallelMatchesSequential() throws Exception {
        when(world.readChunk(any(ChunkPos.class))).thenReturn(sandChunk);

        RgbRaster sequential = renderer(world, RenderSettings.defaults())
                .render(new ChunkRange(-2, -2, 1, 1)).raster();
        MapRenderer.MapResult parallel = renderer(world, new RenderSettings(2, 4))
                .render(new ChunkRange(-2, -2, 1, 1));

        assertThat(parallel.rendered()).isEqualTo(16);
        assertThat(parallel.raster().width()).isEqualTo(sequential.width() * 2);
        for (int y = 0; y < sequential.height(); y++) {
            for (int x = 0; x < sequential.width(); x++) {
                assertThat(parallel.raster().get(x * 2, y * 2)).isEqualTo(sequential.get(x, y));
            }
        }
        verify(world, times(32)).readChunk(any(ChunkPos.class));
    }

    @Test
    void chunkRange_rejectsInvertedBounds() {
        assertThatThrownBy(() -> new ChunkRange(2, 0, 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new ChunkRange(-1, -1, 1, 0).chunks())
                .containsExactly(new ChunkPos(-1, -1), new ChunkPos(0, -1), new ChunkPos(1, -1),
                        new ChunkPos(-1, 0), new ChunkPos(0, 0), new ChunkPos(1, 0));
    }
}
