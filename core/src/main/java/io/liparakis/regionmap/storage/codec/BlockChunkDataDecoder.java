package io.liparakis.regionmap.storage.codec;

import io.liparakis.regionmap.storage.ByteCursor;
import io.liparakis.regionmap.storage.CorruptFormatException;
import io.liparakis.regionmap.storage.RegionMapConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoder for the {@code BlockChunk.Data} blob (little-endian):
 * <pre>
 * u8    needs physics
 * u16   height palette count
 * u16[] height palette
 * u32   height packed length
 * ...   height indices, 10 bits each
 * u16   tint palette count
 * u32[] tint palette, 0xRRGGBB
 * u32   tint packed length
 * ...   tint indices, 10 bits each
 * </pre>
 */
public final class BlockChunkDataDecoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(BlockChunkDataDecoder.class);

    /** Tint used for indices outside the tint palette. */
    public static final int DEFAULT_TINT = 0xFFFFFF;

    private static final int WIDTH = RegionMapConstants.SECTION_SIZE;

    private BlockChunkDataDecoder() {
    }

    /**
     * @throws CorruptFormatException if any field runs past the end of the blob
     */
    public static BlockChunkData decode(byte[] data) throws CorruptFormatException {
        ByteCursor cursor = new ByteCursor(data);

        boolean needsPhysics = cursor.readU8("needs physics flag") != 0;

        int heightPaletteCount = cursor.readU16LE("height palette count");
        int[] heightPalette = new int[heightPaletteCount];
        for (int i = 0; i < heightPaletteCount; i++) {
            heightPalette[i] = cursor.readU16LE("height palette entry");
        }
        int heightPackedLength = cursor.readLengthLE("height packed length");
        byte[] heightPacked = cursor.readBytes("height packed data", heightPackedLength);

        int tintPaletteCount = cursor.readU16LE("tint palette count");
        int[] tintPalette = new int[tintPaletteCount];
        for (int i = 0; i < tintPaletteCount; i++) {
            tintPalette[i] = (int) (cursor.readU32LE("tint palette entry") & 0xFFFFFF);
        }
        int tintPackedLength = cursor.readLengthLE("tint packed length");
        byte[] tintPacked = cursor.readBytes("tint packed data", tintPackedLength);

        LOGGER.debug("BlockChunk: physics={}, heights={} ({} bytes), tints={} ({} bytes)",
                needsPhysics, heightPaletteCount, heightPackedLength, tintPaletteCount, tintPackedLength);

        int[] heightIndices = DenseBitfieldCodec.unpackTenBitIndices(heightPacked);
        int[][] heights = BlockChunkData.emptyGrid();
        for (int i = 0; i < heightIndices.length; i++) {
            int x = i % WIDTH;
            int z = i / WIDTH;
            int index = heightIndices[i];
            heights[z][x] = index < heightPalette.length ? heightPalette[index] : 0;
        }

        int[] tintIndices = DenseBitfieldCodec.unpackTenBitIndices(tintPacked);
        int[][] tints = BlockChunkData.emptyGrid();
        for (int i = 0; i < tintIndices.length; i++) {
            int z = i % WIDTH;
            int x = i / WIDTH;
            int index = tintIndices[i];
            tints[z][x] = index < tintPalette.length ? tintPalette[index] : DEFAULT_TINT;
        }

        return new BlockChunkData(needsPhysics, heights, tints);
    }
}
