package io.liparakis.regionmap.render;

import io.liparakis.regionmap.ChunkFixtures;
import io.liparakis.regionmap.storage.ChunkDocument;
import io.liparakis.regionmap.storage.PayloadDecoder;
import io.liparakis.regionmap.storage.codec.FluidCell;
import io.liparakis.regionmap.storage.codec.PaletteEncoding;
import io.liparakis.regionmap.storage.codec.SectionPaletteCodec;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SurfaceExtractor} on synthetic chunks.
 */
class SurfaceExtractorTest {

    private static final String[] FLUIDS = {"Empty", "Water_Source", "Lava_Source"};

    private static ChunkDocument decode(BsonDocument document) throws Exception {
        return new PayloadDecoder().toChunkDocument(document);
    }

    /**
     * Section 0 solid up to and including {@code floorY} in every column.
     */
    private static byte[] floor(int floorY) {
        byte[] indices = ChunkFixtures.filledByteArray(1);
        for (int y = 0; y <= floorY; y++) {
            for (int z = 0; z < 32; z++) {
                for (int x = 0; x < 32; x++) {
                    indices[SectionPaletteCodec.cellIndex(x, y, z)] = 0;
                }
            }
        }
        return ChunkFixtures.blockSection(PaletteEncoding.BYTE, new String[] {"Rock_Stone", "Empty"}, indices);
    }

    private static byte[] fluid(int x, int z, int[] ys, int[] typeIds) {
        byte[] types = ChunkFixtures.filledByteArray(0);
        byte[] levels = new byte[PaletteEncoding.HALF_BYTE.arraySize()];
        for (int i = 0; i < ys.length; i++) {
            int cell = SectionPaletteCodec.cellIndex(x, ys[i], z);
            types[cell] = (byte) typeIds[i];
            ChunkFixtures.setNibble(levels, cell, 8);
        }
        return ChunkFixtures.fluidSection(PaletteEncoding.BYTE, new int[] {0, 1, 2}, FLUIDS, types, levels);
    }

    private static ChunkDocument chunk(byte[] section0Blocks, byte[] section0Fluids) throws Exception {
        byte[][] blocks = new byte[10][];
        byte[][] fluids = new byte[10][];
        blocks[0] = section0Blocks;
        fluids[0] = section0Fluids;
        return decode(ChunkFixtures.chunkDocument(blocks, fluids, null));
    }

    // ===== Surface height =====

    @Test
    void findSurfaceHeight_singleGrassBlock() throws Exception {
        byte[] indices = ChunkFixtures.filledByteArray(1);
        indices[SectionPaletteCodec.cellIndex(5, 20, 10)] = 0;
        ChunkDocument document = decode(ChunkFixtures.singleSectionChunk(
                ChunkFixtures.blockSection(PaletteEncoding.BYTE, new String[] {"Soil_Grass", "Empty"}, indices)));

        SurfaceExtractor extractor = new SurfaceExtractor(document);

        assertThat(extractor.findSurfaceHeight(5, 10)).isEqualTo(new SurfaceHit(20, "Soil_Grass", 0));
        for (int z = 0; z < 32; z++) {
            for (int x = 0; x < 32; x++) {
                if (x != 5 || z != 10) {
                    assertThat(extractor.findSurfaceHeight(x, z)).isEqualTo(SurfaceHit.NONE);
                }
            }
        }
    }

    @Test
    void findSurfaceHeight_allEmptyChunk_returnsDefault() throws Exception {
        SurfaceExtractor extractor = new SurfaceExtractor(decode(ChunkFixtures.chunkDocument(null, null, null)));

        ColumnSurfaceData surface = extractor.extract();

        for (int z = 0; z < 32; z++) {
            for (int x = 0; x < 32; x++) {
                assertThat(surface.heightAt(x, z)).isZero();
                assertThat(surface.blockAt(x, z)).isEqualTo("Empty");
                assertThat(surface.fluidAt(x, z)).isEqualTo(FluidColumn.NONE);
            }
        }
    }

    @Test
    void findSurfaceHeight_skipsNonSolidMarkersAndPrefersHigherSections() throws Exception {
        byte[] low = floor(3);
        byte[] highIndices = ChunkFixtures.filledByteArray(2);
        highIndices[SectionPaletteCodec.cellIndex(0, 31, 0)] = 0;
        highIndices[SectionPaletteCodec.cellIndex(0, 30, 0)] = 1;
        byte[] high = ChunkFixtures.blockSection(PaletteEncoding.BYTE,
                new String[] {"*Marker", "Wood_Beech_Trunk", "Empty"}, highIndices);
        byte[][] blocks = new byte[10][];
        blocks[0] = low;
        blocks[4] = high;

        SurfaceExtractor extractor = new SurfaceExtractor(decode(ChunkFixtures.chunkDocument(blocks, null, null)));

        assertThat(extractor.findSurfaceHeight(0, 0)).isEqualTo(new SurfaceHit(4 * 32 + 30, "Wood_Beech_Trunk", 4));
        assertThat(extractor.findSurfaceHeight(1, 0)).isEqualTo(new SurfaceHit(3, "Rock_Stone", 0));
    }

    // ===== Surface fluid =====

    @Test
    void findSurfaceFluid_measuresDepthFromTopOfRun() throws Exception {
        ChunkDocument document = chunk(floor(5), fluid(2, 3, new int[] {6, 7, 8, 9}, new int[] {1, 1, 1, 1}));

        SurfaceExtractor extractor = new SurfaceExtractor(document);

        assertThat(extractor.findSurfaceFluid(2, 3, 5)).isEqualTo(new FluidColumn("Water_Source", 4));
        assertThat(extractor.findSurfaceFluid(0, 0, 5)).isEqualTo(FluidColumn.NONE);
    }

    @Test
    void findSurfaceFluid_stopsAtTypeChange() throws Exception {
        ChunkDocument document = chunk(floor(5),
                fluid(2, 3, new int[] {6, 7, 8, 9, 10, 11}, new int[] {1, 1, 1, 1, 2, 2}));

        FluidColumn column = new SurfaceExtractor(document).findSurfaceFluid(2, 3, 5);

        assertThat(column).isEqualTo(new FluidColumn("Lava_Source", 6));
    }

    @Test
    void findSurfaceFluid_stopsAtGapButKeepsTopRun() throws Exception {
        ChunkDocument document = chunk(floor(5),
                fluid(2, 3, new int[] {7, 8, 20}, new int[] {1, 1, 1}));

        FluidColumn column = new SurfaceExtractor(document).findSurfaceFluid(2, 3, 5);

        assertThat(column).isEqualTo(new FluidColumn("Water_Source", 15));
    }

    @Test
    void findSurfaceFluid_ignoresFluidAtOrBelowSurface() throws Exception {
        ChunkDocument document = chunk(floor(5), fluid(2, 3, new int[] {4, 5}, new int[] {1, 1}));

        assertThat(new SurfaceExtractor(document).findSurfaceFluid(2, 3, 5)).isEqualTo(FluidColumn.NONE);
    }

    @Test
    void extract_fillsParallelGrids() throws Exception {
        ChunkDocument document = chunk(floor(5), fluid(2, 3, new int[] {6, 7}, new int[] {1, 1}));

        ColumnSurfaceData surface = new SurfaceExtractor(document).extract();

        assertThat(surface.heightAt(2, 3)).isEqualTo(5);
        assertThat(surface.blockAt(2, 3)).isEqualTo("Rock_Stone");
        assertThat(surface.fluidAt(2, 3)).isEqualTo(new FluidColumn("Water_Source", 2));
        assertThat(surface.fluidAt(3, 2).isPresent()).isFalse();
    }

    // ===== Point queries =====

    @Test
    void blockAtAndFluidAt_useWorldY() throws Exception {
        ChunkDocument document = chunk(floor(5), fluid(2, 3, new int[] {6}, new int[] {2}));
        SurfaceExtractor extractor = new SurfaceExtractor(document);

        assertThat(extractor.blockAt(2, 5, 3)).isEqualTo("Rock_Stone");
        assertThat(extractor.blockAt(2, 6, 3)).isEqualTo("Empty");
        assertThat(extractor.blockAt(2, 200, 3)).isEqualTo("Empty");
        assertThat(extractor.blockAt(2, 400, 3)).isEqualTo("Empty");
        assertThat(extractor.fluidAt(2, 6, 3)).isEqualTo(new FluidCell("Lava_Source", 8));
        assertThat(extractor.fluidAt(2, 7, 3)).isEqualTo(FluidCell.NONE);
        assertThat(extractor.fluidAt(2, -1, 3)).isEqualTo(FluidCell.NONE);
    }
}
