package io.liparakis.regionmap.storage;

import java.nio.charset.StandardCharsets;

/**
 * Central constants for the region container and chunk section formats.
 * <p>
 * This class provides:
 * - Region container constants (header layout, location table)
 * - Section geometry constants (section size, column height)
 * - Packed array sizes
 */
public final class RegionMapConstants {

    // ==================== Region Container ====================

    /**
     * Identifier stored in the first 20 bytes of every region file.
     */
    public static final String MAGIC = "HytaleIndexedStorage";

    /**
     * {@link #MAGIC} as raw bytes, compared byte-for-byte at open time.
     */
    public static final byte[] MAGIC_BYTES = MAGIC.getBytes(StandardCharsets.US_ASCII);

    /**
     * Length of the region header: magic (20) + version + blob count + segment size.
     */
    public static final int HEADER_LENGTH = 32;

    /**
     * Width of a region in chunks. A region holds 32x32 chunks.
     */
    public static final int REGION_WIDTH_CHUNKS = 32;

    /**
     * Number of entries in the chunk location table.
     */
    public static final int LOCATION_TABLE_ENTRIES = REGION_WIDTH_CHUNKS * REGION_WIDTH_CHUNKS;

    /**
     * Size of one location table entry (uint32 segment index).
     */
    public static final int LOCATION_ENTRY_SIZE = 4;

    /**
     * Size of the {uncompressedSize, compressedSize} prefix in front of each blob.
     */
    public static final int BLOB_PREFIX_SIZE = 8;

    // ==================== Section Geometry ====================

    /**
     * Width, depth and height of a section in blocks.
     */
    public static final int SECTION_SIZE = 32;

    /**
     * Number of cells in one section (32x32x32).
     */
    public static final int SECTION_VOLUME = SECTION_SIZE * SECTION_SIZE * SECTION_SIZE;

    /**
     * Number of vertical sections in a chunk column.
     */
    public static final int SECTIONS_PER_CHUNK = 10;

    /**
     * Highest world Y coordinate covered by a chunk column (319).
     */
    public static final int MAX_Y = SECTIONS_PER_CHUNK * SECTION_SIZE - 1;

    /**
     * Number of columns in a chunk (32x32).
     */
    public static final int COLUMNS_PER_CHUNK = SECTION_SIZE * SECTION_SIZE;

    // ==================== Packed Arrays ====================

    /**
     * Size of the always 4-bit packed fluid level array.
     */
    public static final int FLUID_LEVEL_ARRAY_SIZE = SECTION_VOLUME / 2;

    /**
     * Bits per entry in the heightmap and tint index arrays.
     */
    public static final int DENSE_INDEX_BITS = 10;

    /**
     * Palette name used for empty block and fluid cells.
     */
    public static final String EMPTY = "Empty";

    private RegionMapConstants() {
        throw new AssertionError("RegionMapConstants is a utility class and should not be instantiated");
    }
}
