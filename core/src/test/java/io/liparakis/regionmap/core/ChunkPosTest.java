package io.liparakis.regionmap.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ChunkPos} and {@link RegionPos}.
 */
class ChunkPosTest {

    @ParameterizedTest
    @CsvSource({
            "0, 0, 0, 0",
            "31, 31, 0, 0",
            "32, 64, 1, 2",
            "-1, -1, -1, -1",
            "-32, -33, -1, -2"
    })
    void ofBlock_floorsTowardNegativeInfinity(int blockX, int blockZ, int chunkX, int chunkZ) {
        assertThat(ChunkPos.ofBlock(blockX, blockZ)).isEqualTo(new ChunkPos(chunkX, chunkZ));
    }

    @Test
    void region_andLocalCoordinates() {
        ChunkPos pos = new ChunkPos(-1, 33);

        assertThat(pos.region()).isEqualTo(new RegionPos(-1, 1));
        assertThat(pos.localX()).isEqualTo(31);
        assertThat(pos.localZ()).isEqualTo(1);
    }

    @Test
    void regionFileName() {
        assertThat(new RegionPos(-1, 0).fileName()).isEqualTo("-1.0.region.bin");
        assertThat(new RegionPos(2, 3)).hasToString("r.2.3");
    }

    @Test
    void toString_isCompact() {
        assertThat(new ChunkPos(4, -2)).hasToString("[4, -2]");
    }
}
