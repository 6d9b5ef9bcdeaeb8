package io.liparakis.regionmap.storage.codec;

import org.jetbrains.annotations.Nullable;

/**
 * Fluid state of one cell.
 *
 * @param type  the fluid type name, or {@code null} when the cell holds no fluid
 * @param level the 4-bit fluid level, 0 when empty
 */
public record FluidCell(@Nullable String type, int level) {

    public static final FluidCell NONE = new FluidCell(null, 0);

    public boolean isEmpty() {
        return type == null || level == 0;
    }
}
