package io.liparakis.regionmap.storage.codec;

import io.liparakis.regionmap.core.Palette;
import io.liparakis.regionmap.core.PaletteEntry;
import io.liparakis.regionmap.storage.RegionMapConstants;
import org.jetbrains.annotations.Nullable;

/**
 * A decoded block section: palette plus packed index array.
 * <p>
 * The leading 4-byte and trailing 1-byte header fields have no known meaning
 * and are kept as read.
 */
public final class BlockSection {
    private final long unknownLeading;
    private final int unknownTrailing;
    private final PaletteEncoding encoding;
    private final Palette<PaletteEntry> palette;
    private final byte @Nullable [] indexArray;

    BlockSection(long unknownLeading, int unknownTrailing, PaletteEncoding encoding,
            Palette<PaletteEntry> palette, byte @Nullable [] indexArray) {
        this.unknownLeading = unknownLeading;
        this.unknownTrailing = unknownTrailing;
        this.encoding = encoding;
        this.palette = palette;
        this.indexArray = indexArray;
    }

    public long unknownLeading() {
        return unknownLeading;
    }

    public int unknownTrailing() {
        return unknownTrailing;
    }

    public PaletteEncoding encoding() {
        return encoding;
    }

    public Palette<PaletteEntry> palette() {
        return palette;
    }

    /**
     * @return false for {@link PaletteEncoding#EMPTY} sections
     */
    public boolean hasBlocks() {
        return indexArray != null;
    }

    public byte @Nullable [] indexArray() {
        return indexArray;
    }

    /**
     * Returns the block name at local coordinates (0-31).
     *
     * @return the palette name, or {@code "Empty"} if the section has no array
     *         or the id is not in the palette
     */
    public String blockAt(int x, int y, int z) {
        if (indexArray == null) {
            return RegionMapConstants.EMPTY;
        }
        int id = SectionPaletteCodec.readPaletteId(indexArray, encoding, SectionPaletteCodec.cellIndex(x, y, z));
        PaletteEntry entry = palette.get(id);
        return entry == null ? RegionMapConstants.EMPTY : entry.name();
    }
}
