package io.liparakis.regionmap.render;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.OptionalInt;

/**
 * Display properties of one block type.
 *
 * @param tintColors       tint colours in declaration order, {@code 0xRRGGBB}
 * @param biomeTintPercent how much of the column's biome tint replaces the base colour (0-100)
 * @param particleColor    secondary colour, {@code 0xRRGGBB}
 */
public record BlockProperties(IntList tintColors, int biomeTintPercent, OptionalInt particleColor) {

    public BlockProperties {
        tintColors = IntLists.unmodifiable(tintColors);
        biomeTintPercent = Math.max(0, Math.min(100, biomeTintPercent));
    }
}
