package io.liparakis.regionmap.storage;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * A decoded chunk: exactly {@value RegionMapConstants#SECTIONS_PER_CHUNK}
 * sections ordered bottom to top, plus the optional heightmap/tint blob.
 */
public final class ChunkDocument {
    private final List<SectionDocument> sections;
    private final byte @Nullable [] blockChunkData;

    /**
     * @throws IllegalArgumentException if the section count is not 10
     */
    public ChunkDocument(List<SectionDocument> sections, byte @Nullable [] blockChunkData) {
        if (sections.size() != RegionMapConstants.SECTIONS_PER_CHUNK) {
            throw new IllegalArgumentException("Expected " + RegionMapConstants.SECTIONS_PER_CHUNK
                    + " sections, got " + sections.size());
        }
        this.sections = List.copyOf(sections);
        this.blockChunkData = blockChunkData;
    }

    public List<SectionDocument> sections() {
        return sections;
    }

    public SectionDocument section(int index) {
        return sections.get(index);
    }

    /**
     * @return the raw {@code BlockChunk} blob, if the chunk carries one
     */
    public Optional<byte[]> blockChunkData() {
        return Optional.ofNullable(blockChunkData);
    }
}
