package io.liparakis.regionmap.storage.codec;

import io.liparakis.regionmap.storage.RegionMapConstants;

/**
 * Unpacks the 10-bit palette index arrays of the heightmap and tint data.
 * <p>
 * Entries are packed contiguously, least significant bit first: entry
 * {@code i} starts at bit {@code i * 10}. 1024 entries fill 1280 bytes.
 * <p>
 * The two arrays map a linear index to a column differently and are kept
 * that way:
 * <ul>
 *   <li>heightmap: {@code x = i % 32, z = i / 32}</li>
 *   <li>tint: {@code z = i % 32, x = i / 32}</li>
 * </ul>
 */
public final class DenseBitfieldCodec {
    private static final int BITS = RegionMapConstants.DENSE_INDEX_BITS;
    private static final int MASK = (1 << BITS) - 1;
    private static final int WIDTH = RegionMapConstants.SECTION_SIZE;

    private DenseBitfieldCodec() {
    }

    /**
     * Unpacks {@code count} 10-bit values. Bytes past the end of {@code packed}
     * read as zero.
     */
    public static int[] unpackTenBitIndices(byte[] packed, int count) {
        int[] out = new int[count];
        for (int i = 0; i < count; i++) {
            int bitOffset = i * BITS;
            int byteOffset = bitOffset >> 3;
            int bitInByte = bitOffset & 7;
            int b1 = byteOffset < packed.length ? packed[byteOffset] & 0xFF : 0;
            int b2 = byteOffset + 1 < packed.length ? packed[byteOffset + 1] & 0xFF : 0;
            out[i] = ((b1 >> bitInByte) | (b2 << (8 - bitInByte))) & MASK;
        }
        return out;
    }

    /**
     * Unpacks a full 1024-entry array.
     */
    public static int[] unpackTenBitIndices(byte[] packed) {
        return unpackTenBitIndices(packed, RegionMapConstants.COLUMNS_PER_CHUNK);
    }

    /**
     * Packs 10-bit values into the same layout {@link #unpackTenBitIndices} reads.
     * Used to build fixtures and by tooling; values are masked to 10 bits.
     */
    public static byte[] packTenBitIndices(int[] values) {
        byte[] out = new byte[(values.length * BITS + 7) / 8];
        for (int i = 0; i < values.length; i++) {
            int value = values[i] & MASK;
            int bitOffset = i * BITS;
            int byteOffset = bitOffset >> 3;
            int bitInByte = bitOffset & 7;
            int shifted = value << bitInByte;
            out[byteOffset] |= (byte) shifted;
            out[byteOffset + 1] |= (byte) (shifted >> 8);
        }
        return out;
    }

    /**
     * @return the linear heightmap index of a column
     */
    public static int heightmapIndex(int x, int z) {
        return x + z * WIDTH;
    }

    /**
     * @return the linear tint index of a column
     */
    public static int tintIndex(int x, int z) {
        return z + x * WIDTH;
    }
}
