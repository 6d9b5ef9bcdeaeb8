package io.liparakis.regionmap.storage.codec;

import io.liparakis.regionmap.core.Palette;
import io.liparakis.regionmap.core.PaletteEntry;
import io.liparakis.regionmap.storage.ByteCursor;
import io.liparakis.regionmap.storage.CorruptFormatException;
import io.liparakis.regionmap.storage.RegionMapConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoder for the palette-compressed block and fluid blobs stored per section.
 * <p>
 * Block blob (big-endian):
 * <pre>
 * u32   unknown (kept opaque)
 * u8    encoding (0 Empty, 1 HalfByte, 2 Byte, 3 Short)
 * u16   palette length
 * i8    unknown (kept opaque)
 * [palette length] { u16 name length, name, u16 count, i8 unknown }   id = position
 * index array (0 / 16384 / 32768 / 65536 bytes by encoding)
 * </pre>
 * Fluid blob (big-endian):
 * <pre>
 * u8    encoding
 * u16   palette length
 * [palette length] { id (u16 for Short, else u8), u16 name length, name, u16 count }
 * type array (sized as for blocks)
 * level array, always 16384 bytes, 4 bits per cell
 * </pre>
 * Cells are addressed Y-major, then Z, then X (see {@link #cellIndex}).
 */
public final class SectionPaletteCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(SectionPaletteCodec.class);

    private static final int COORD_MASK = 31;

    private SectionPaletteCodec() {
    }

    /**
     * Flat index of a cell within a section.
     *
     * @param x local X (0-31)
     * @param y local Y (0-31)
     * @param z local Z (0-31)
     * @return {@code y << 10 | z << 5 | x}
     */
    public static int cellIndex(int x, int y, int z) {
        return ((y & COORD_MASK) << 10) | ((z & COORD_MASK) << 5) | (x & COORD_MASK);
    }

    /**
     * Reads the palette id stored for a cell.
     *
     * @param array     the packed index array
     * @param encoding  the array's encoding
     * @param flatIndex the cell's flat index
     * @return the palette id
     */
    public static int readPaletteId(byte[] array, PaletteEncoding encoding, int flatIndex) {
        return encoding.readId(array, flatIndex);
    }

    /**
     * Decodes a block section blob.
     *
     * @param data the {@code Block.Data} blob
     * @return the decoded section
     * @throws CorruptFormatException if the blob is truncated or the encoding is unknown
     */
    public static BlockSection decodeBlockSection(byte[] data) throws CorruptFormatException {
        ByteCursor cursor = new ByteCursor(data);

        long unknownLeading = cursor.readU32BE("block section leading field");
        int encodingByte = cursor.readU8("block palette encoding");
        int paletteLength = cursor.readU16BE("block palette length");
        int unknownTrailing = cursor.readI8("block section trailing field");

        PaletteEncoding encoding = PaletteEncoding.fromWireValue(encodingByte);
        if (encoding == null) {
            throw new CorruptFormatException(String.format(
                    "Unknown block palette encoding: 0x%02X", encodingByte));
        }

        Palette<PaletteEntry> palette = new Palette<>();
        for (int i = 0; i < paletteLength; i++) {
            int nameLength = cursor.readU16BE("block palette name length");
            String name = cursor.readUtf8("block palette name", nameLength);
            int count = cursor.readU16BE("block palette count");
            cursor.readI8("block palette trailing field");
            palette.append(new PaletteEntry(name, count));
        }

        byte[] indexArray = encoding == PaletteEncoding.EMPTY
                ? null
                : cursor.readBytes("block index array", encoding.arraySize());

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Block section: leading=0x{}, encoding={}, palette={}, trailing=0x{}",
                    Long.toHexString(unknownLeading), encoding, palette.entries(),
                    Integer.toHexString(unknownTrailing & 0xFF));
        }

        return new BlockSection(unknownLeading, unknownTrailing, encoding, palette, indexArray);
    }

    /**
     * Decodes a fluid section blob. Never fails: any structural problem yields a
     * section without type and level arrays.
     *
     * @param data the {@code Fluid.Data} blob
     * @return the decoded section
     */
    public static FluidSection decodeFluidSection(byte[] data) {
        try {
            return readFluidSection(new ByteCursor(data));
        } catch (CorruptFormatException e) {
            LOGGER.debug("Treating malformed fluid section as empty: {}", e.getMessage());
            return FluidSection.absent();
        }
    }

    private static FluidSection readFluidSection(ByteCursor cursor) throws CorruptFormatException {
        int encodingByte = cursor.readU8("fluid palette encoding");
        int paletteLength = cursor.readU16BE("fluid palette length");

        PaletteEncoding encoding = PaletteEncoding.fromWireValue(encodingByte);
        if (encoding == null) {
            throw new CorruptFormatException(String.format(
                    "Unknown fluid palette encoding: 0x%02X", encodingByte));
        }

        Palette<PaletteEntry> palette = new Palette<>();
        for (int i = 0; i < paletteLength; i++) {
            int id = encoding == PaletteEncoding.SHORT
                    ? cursor.readU16BE("fluid palette id")
                    : cursor.readU8("fluid palette id");
            int nameLength = cursor.readU16BE("fluid palette name length");
            String name = cursor.readUtf8("fluid palette name", nameLength);
            int count = cursor.readU16BE("fluid palette count");
            palette.put(id, new PaletteEntry(name, count));
        }

        byte[] typeArray = encoding == PaletteEncoding.EMPTY
                ? null
                : cursor.readBytes("fluid type array", encoding.arraySize());
        byte[] levelArray = cursor.readBytes("fluid level array", RegionMapConstants.FLUID_LEVEL_ARRAY_SIZE);

        if (typeArray == null) {
            return new FluidSection(encoding, palette, null, null);
        }
        return new FluidSection(encoding, palette, typeArray, levelArray);
    }
}
