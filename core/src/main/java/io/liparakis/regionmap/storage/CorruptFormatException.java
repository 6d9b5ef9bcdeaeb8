package io.liparakis.regionmap.storage;

import java.io.IOException;

/**
 * Thrown when binary region, section or bitfield data is structurally invalid:
 * a magic mismatch, an unknown encoding, or a read past the end of the buffer.
 */
public class CorruptFormatException extends IOException {

    private final int offset;
    private final int expected;
    private final int available;

    public CorruptFormatException(String message) {
        super(message);
        this.offset = -1;
        this.expected = -1;
        this.available = -1;
    }

    /**
     * Creates an exception describing a truncated read.
     *
     * @param what      the field being read
     * @param offset    the read offset
     * @param expected  the number of bytes requested
     * @param available the number of bytes left at {@code offset}
     */
    public CorruptFormatException(String what, int offset, int expected, int available) {
        super(String.format("Truncated data reading %s at offset %d: expected %d bytes, %d available",
                what, offset, expected, available));
        this.offset = offset;
        this.expected = expected;
        this.available = available;
    }

    /**
     * @return the offset of the failed read, or -1 if not a truncation
     */
    public int getOffset() {
        return offset;
    }

    public int getExpected() {
        return expected;
    }

    public int getAvailable() {
        return available;
    }
}
