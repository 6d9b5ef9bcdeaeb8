package io.liparakis.regionmap.storage.codec;

import io.liparakis.regionmap.core.Palette;
import io.liparakis.regionmap.core.PaletteEntry;
import io.liparakis.regionmap.storage.RegionMapConstants;
import org.jetbrains.annotations.Nullable;

/**
 * A decoded fluid section. When the stored blob was malformed, both arrays are
 * absent and every cell reads as {@link FluidCell#NONE}.
 */
public final class FluidSection {
    private final PaletteEncoding encoding;
    private final Palette<PaletteEntry> palette;
    private final byte @Nullable [] typeArray;
    private final byte @Nullable [] levelArray;

    FluidSection(PaletteEncoding encoding, Palette<PaletteEntry> palette,
            byte @Nullable [] typeArray, byte @Nullable [] levelArray) {
        this.encoding = encoding;
        this.palette = palette;
        this.typeArray = typeArray;
        this.levelArray = levelArray;
    }

    /**
     * @return a new section with an empty palette and no arrays
     */
    static FluidSection absent() {
        return new FluidSection(PaletteEncoding.EMPTY, new Palette<>(), null, null);
    }

    public PaletteEncoding encoding() {
        return encoding;
    }

    public Palette<PaletteEntry> palette() {
        return palette;
    }

    public byte @Nullable [] typeArray() {
        return typeArray;
    }

    public byte @Nullable [] levelArray() {
        return levelArray;
    }

    public boolean hasFluidData() {
        return typeArray != null && levelArray != null;
    }

    /**
     * Returns the fluid at local coordinates (0-31).
     */
    public FluidCell fluidAt(int x, int y, int z) {
        if (typeArray == null || levelArray == null) {
            return FluidCell.NONE;
        }
        int index = SectionPaletteCodec.cellIndex(x, y, z);
        int level = PaletteEncoding.HALF_BYTE.readId(levelArray, index);
        PaletteEntry entry = palette.get(encoding.readId(typeArray, index));
        if (level == 0 || entry == null || RegionMapConstants.EMPTY.equals(entry.name())) {
            return FluidCell.NONE;
        }
        return new FluidCell(entry.name(), level);
    }
}
