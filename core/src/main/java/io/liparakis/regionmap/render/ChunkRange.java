package io.liparakis.regionmap.render;

import io.liparakis.regionmap.core.ChunkPos;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * An inclusive rectangle of chunk coordinates.
 */
public record ChunkRange(int startX, int startZ, int endX, int endZ) {

    public ChunkRange {
        if (endX < startX || endZ < startZ) {
            throw new IllegalArgumentException(String.format(
                    "Empty chunk range (%d, %d) to (%d, %d)", startX, startZ, endX, endZ));
        }
    }

    public int widthChunks() {
        return endX - startX + 1;
    }

    public int heightChunks() {
        return endZ - startZ + 1;
    }

    public int size() {
        return widthChunks() * heightChunks();
    }

    /**
     * Chunks in row order: Z outer, X inner.
     */
    public List<ChunkPos> chunks() {
        List<ChunkPos> chunks = new ArrayList<>(size());
        for (int z = startZ; z <= endZ; z++) {
            for (int x = startX; x <= endX; x++) {
                chunks.add(new ChunkPos(x, z));
            }
        }
        return chunks;
    }

    @Override
    public @NotNull String toString() {
        return String.format("(%d, %d) to (%d, %d)", startX, startZ, endX, endZ);
    }
}
