package io.liparakis.regionmap.core;

/**
 * One palette entry: a block or fluid type name and the count stored with it.
 *
 * @param name  the type name, e.g. {@code Soil_Grass}
 * @param count the stored count (uint16), believed to be the number of cells using it
 */
public record PaletteEntry(String name, int count) {
}
