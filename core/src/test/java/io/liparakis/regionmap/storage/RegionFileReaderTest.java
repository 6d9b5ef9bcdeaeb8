package io.liparakis.regionmap.storage;

import io.liparakis.regionmap.ChunkFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RegionFileReader} against synthetic region files.
 */
class RegionFileReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void header_isParsed() throws Exception {
        Path file = ChunkFixtures.writeRegion(tempDir.resolve("0.0.region.bin"),
                Map.of(0, new byte[] {1, 2, 3}), Map.of(0, 99));

        try (RegionFileReader reader = new RegionFileReader(file)) {
            RegionFileReader.Header header = reader.header();
            assertThat(header.magic()).isEqualTo(RegionMapConstants.MAGIC);
            assertThat(header.version()).isEqualTo(1);
            assertThat(header.blobCount()).isEqualTo(1);
            assertThat(header.segmentSize()).isEqualTo(ChunkFixtures.SEGMENT_SIZE);
        }
    }

    @Test
    void readChunk_returnsSizeHintAndExactBytes() throws Exception {
        byte[] first = {10, 20, 30};
        byte[] second = new byte[5000];
        Arrays.fill(second, (byte) 7);
        Path file = ChunkFixtures.writeRegion(tempDir.resolve("0.0.region.bin"),
                Map.of(0, first, 3 + 2 * 32, second), Map.of(0, 42, 3 + 2 * 32, 6000));

        try (RegionFileReader reader = new RegionFileReader(file)) {
            RegionFileReader.ChunkBlob a = reader.readChunk(0, 0);
            assertThat(a.uncompressedSizeHint()).isEqualTo(42);
            assertThat(a.compressed()).containsExactly(first);

            RegionFileReader.ChunkBlob b = reader.readChunk(3, 2);
            assertThat(b.uncompressedSizeHint()).isEqualTo(6000);
            assertThat(b.compressed()).isEqualTo(second);
        }
    }

    @Test
    void locateChunk_zeroSegment_throwsNotFound() throws Exception {
        Path file = ChunkFixtures.writeRegion(tempDir.resolve("0.0.region.bin"),
                Map.of(5, new byte[] {1}), Map.of());

        try (RegionFileReader reader = new RegionFileReader(file)) {
            assertThatThrownBy(() -> reader.locateChunk(0, 0))
                    .isInstanceOf(ChunkNotFoundException.class)
                    .hasMessageContaining("(0, 0)");
            assertThat(reader.locateChunk(5, 0)).isEqualTo(1);
        }
    }

    @Test
    void locateChunk_outsideRegion_throwsIllegalArgument() throws Exception {
        Path file = ChunkFixtures.writeRegion(tempDir.resolve("0.0.region.bin"), Map.of(), Map.of());

        try (RegionFileReader reader = new RegionFileReader(file)) {
            assertThatThrownBy(() -> reader.locateChunk(32, 0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> reader.locateChunk(0, -1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void presentChunks_listsOccupiedEntriesInTableOrder() throws Exception {
        Path file = ChunkFixtures.writeRegion(tempDir.resolve("0.0.region.bin"),
                Map.of(1 + 32, new byte[] {1}, 4, new byte[] {2}), Map.of());

        try (RegionFileReader reader = new RegionFileReader(file)) {
            List<RegionFileReader.ChunkEntry> chunks = reader.presentChunks();
            assertThat(chunks).extracting(RegionFileReader.ChunkEntry::localX).containsExactly(4, 1);
            assertThat(chunks).extracting(RegionFileReader.ChunkEntry::localZ).containsExactly(0, 1);
        }
    }

    @Test
    void missingFile_throwsNotFound() {
        assertThatThrownBy(() -> new RegionFileReader(tempDir.resolve("9.9.region.bin")))
                .isInstanceOf(ChunkNotFoundException.class);
    }

    @Test
    void badMagic_throwsCorruptFormat() throws Exception {
        Path file = ChunkFixtures.writeRegion(tempDir.resolve("0.0.region.bin"), Map.of(), Map.of());
        byte[] bytes = Files.readAllBytes(file);
        bytes[0] = 'X';
        Files.write(file, bytes);

        assertThatThrownBy(() -> new RegionFileReader(file))
                .isInstanceOf(CorruptFormatException.class)
                .hasMessageContaining("Invalid region magic");
    }

    @Test
    void truncatedHeader_throwsCorruptFormat() throws Exception {
        Path file = tempDir.resolve("short.region.bin");
        Files.write(file, RegionMapConstants.MAGIC_BYTES);

        assertThatThrownBy(() -> new RegionFileReader(file)).isInstanceOf(CorruptFormatException.class);
    }

    @Test
    void blobShorterThanDeclared_throwsCorruptFormat() throws Exception {
        Path file = ChunkFixtures.writeRegionWithDeclaredSize(tempDir.resolve("0.0.region.bin"), 100, new byte[10]);

        try (RegionFileReader reader = new RegionFileReader(file)) {
            assertThatThrownBy(() -> reader.readChunk(0, 0))
                    .isInstanceOfSatisfying(CorruptFormatException.class, e -> {
                        assertThat(e.getExpected()).isEqualTo(100);
                        assertThat(e.getAvailable()).isEqualTo(10);
                    });
        }
    }

    @Test
    void blobDeclaringHugeSize_throwsCorruptFormatBeforeAllocating() throws Exception {
        Path file = ChunkFixtures.writeRegionWithDeclaredSize(tempDir.resolve("0.0.region.bin"),
                Integer.MAX_VALUE, new byte[10]);

        try (RegionFileReader reader = new RegionFileReader(file)) {
            assertThatThrownBy(() -> reader.readChunk(0, 0))
                    .isInstanceOfSatisfying(CorruptFormatException.class, e -> {
                        assertThat(e.getExpected()).isEqualTo(Integer.MAX_VALUE);
                        assertThat(e.getAvailable()).isEqualTo(10);
                        assertThat(e.getOffset()).isEqualTo(ChunkFixtures.SEGMENT_SIZE + 32 + 8);
                    });
        }
    }

    @Test
    void close_releasesFile() throws IOException {
        Path file = ChunkFixtures.writeRegion(tempDir.resolve("0.0.region.bin"), Map.of(), Map.of());
        RegionFileReader reader = new RegionFileReader(file);
        reader.close();

        Files.delete(file);
        assertThat(file).doesNotExist();
    }
}
