package io.liparakis.regionmap.storage.codec;

import io.liparakis.regionmap.storage.RegionMapConstants;

/**
 * Width of the per-cell palette references in a section's index array.
 * Stored on the wire as a single byte (0-3). Every width addresses the same
 * 32x32x32 cell grid.
 */
public enum PaletteEncoding {
    /** No array; every cell is empty. */
    EMPTY(0, 0),
    /** 4 bits per cell, even cell in the low nibble. */
    HALF_BYTE(1, RegionMapConstants.SECTION_VOLUME / 2),
    /** 8 bits per cell. */
    BYTE(2, RegionMapConstants.SECTION_VOLUME),
    /** 16 bits per cell, big-endian. */
    SHORT(3, RegionMapConstants.SECTION_VOLUME * 2);

    private static final PaletteEncoding[] BY_WIRE_VALUE = values();

    private final int wireValue;
    private final int arraySize;

    PaletteEncoding(int wireValue, int arraySize) {
        this.wireValue = wireValue;
        this.arraySize = arraySize;
    }

    /**
     * @return the encoding for a wire value, or {@code null} if unknown
     */
    public static PaletteEncoding fromWireValue(int value) {
        return value >= 0 && value < BY_WIRE_VALUE.length ? BY_WIRE_VALUE[value] : null;
    }

    public int wireValue() {
        return wireValue;
    }

    /**
     * @return the index array length in bytes for this encoding
     */
    public int arraySize() {
        return arraySize;
    }

    /**
     * Reads the palette id of a cell.
     *
     * @param array     the index array, {@link #arraySize()} bytes long
     * @param flatIndex the cell index from {@link SectionPaletteCodec#cellIndex}
     * @return the palette id, or 0 for {@link #EMPTY}
     */
    public int readId(byte[] array, int flatIndex) {
        return switch (this) {
            case EMPTY -> 0;
            case HALF_BYTE -> {
                int b = array[flatIndex >> 1] & 0xFF;
                yield (flatIndex & 1) == 0 ? b & 0x0F : (b >> 4) & 0x0F;
            }
            case BYTE -> array[flatIndex] & 0xFF;
            case SHORT -> ((array[flatIndex * 2] & 0xFF) << 8) | (array[flatIndex * 2 + 1] & 0xFF);
        };
    }
}
