package io.liparakis.regionmap.render;

import org.jetbrains.annotations.Nullable;

/**
 * Fluid resting on top of a column's surface.
 *
 * @param type  the fluid type, or {@code null} when there is none
 * @param depth topmost fluid Y minus surface Y, 0 when there is no fluid
 */
public record FluidColumn(@Nullable String type, int depth) {

    public static final FluidColumn NONE = new FluidColumn(null, 0);

    public boolean isPresent() {
        return type != null && depth > 0;
    }
}
