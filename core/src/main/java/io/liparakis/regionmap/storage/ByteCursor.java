package io.liparakis.regionmap.storage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Sequential reader over a byte array with an explicit byte order on every
 * multi-byte read.
 * <p>
 * Every read checks the remaining length first and fails with a
 * {@link CorruptFormatException} naming the field, offset and expected length,
 * so truncated input never surfaces as an index error further down.
 * Not thread-safe.
 */
public final class ByteCursor {
    private final byte[] data;
    private final int end;
    private int position;

    public ByteCursor(byte[] data) {
        this(data, 0, data.length);
    }

    /**
     * @param data   backing array
     * @param offset first readable byte
     * @param length number of readable bytes
     */
    public ByteCursor(byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException(String.format(
                    "Window [%d, %d) outside array of %d bytes", offset, offset + length, data.length));
        }
        this.data = data;
        this.position = offset;
        this.end = offset + length;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return end - position;
    }

    public boolean hasRemaining(int bytes) {
        return remaining() >= bytes;
    }

    public int readU8(String what) throws CorruptFormatException {
        require(what, 1);
        return data[position++] & 0xFF;
    }

    public int readI8(String what) throws CorruptFormatException {
        require(what, 1);
        return data[position++];
    }

    public int readU16BE(String what) throws CorruptFormatException {
        require(what, 2);
        int value = ((data[position] & 0xFF) << 8) | (data[position + 1] & 0xFF);
        position += 2;
        return value;
    }

    public int readU16LE(String what) throws CorruptFormatException {
        require(what, 2);
        int value = (data[position] & 0xFF) | ((data[position + 1] & 0xFF) << 8);
        position += 2;
        return value;
    }

    /**
     * Reads an unsigned big-endian 32-bit value.
     */
    public long readU32BE(String what) throws CorruptFormatException {
        require(what, 4);
        long value = ((long) (data[position] & 0xFF) << 24)
                | ((data[position + 1] & 0xFF) << 16)
                | ((data[position + 2] & 0xFF) << 8)
                | (data[position + 3] & 0xFF);
        position += 4;
        return value;
    }

    /**
     * Reads an unsigned little-endian 32-bit value.
     */
    public long readU32LE(String what) throws CorruptFormatException {
        require(what, 4);
        long value = (data[position] & 0xFF)
                | ((data[position + 1] & 0xFF) << 8)
                | ((data[position + 2] & 0xFF) << 16)
                | ((long) (data[position + 3] & 0xFF) << 24);
        position += 4;
        return value;
    }

    /**
     * Reads an unsigned 32-bit length or index that must fit in an {@code int}.
     */
    public int readLengthBE(String what) throws CorruptFormatException {
        return toLength(what, readU32BE(what));
    }

    public int readLengthLE(String what) throws CorruptFormatException {
        return toLength(what, readU32LE(what));
    }

    public byte[] readBytes(String what, int length) throws CorruptFormatException {
        require(what, length);
        byte[] out = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return out;
    }

    public String readUtf8(String what, int length) throws CorruptFormatException {
        require(what, length);
        String value = new String(data, position, length, StandardCharsets.UTF_8);
        position += length;
        return value;
    }

    public void skip(String what, int length) throws CorruptFormatException {
        require(what, length);
        position += length;
    }

    private void require(String what, int length) throws CorruptFormatException {
        if (length < 0 || end - position < length) {
            throw new CorruptFormatException(what, position, length, end - position);
        }
    }

    private int toLength(String what, long value) throws CorruptFormatException {
        if (value > Integer.MAX_VALUE) {
            throw new CorruptFormatException(String.format(
                    "Value of %s at offset %d too large: %d", what, position - 4, value));
        }
        return (int) value;
    }
}
