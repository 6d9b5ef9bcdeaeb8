package io.liparakis.regionmap.storage;

import java.io.IOException;

/**
 * Thrown when a chunk is not stored: its location table entry is 0 or its
 * region file does not exist.
 */
public class ChunkNotFoundException extends IOException {

    public ChunkNotFoundException(String message) {
        super(message);
    }
}
