package io.liparakis.regionmap.core;

import org.jetbrains.annotations.NotNull;

/**
 * Region coordinates. A region holds 32x32 chunks in one file.
 *
 * @param x the region's X coordinate
 * @param z the region's Z coordinate
 */
public record RegionPos(int x, int z) {

    /**
     * @return the file name of this region, e.g. {@code -1.0.region.bin}
     */
    public String fileName() {
        return x + "." + z + ".region.bin";
    }

    @Override
    public @NotNull String toString() {
        return "r." + x + "." + z;
    }
}
