package io.liparakis.regionmap.storage;

import java.io.IOException;

/**
 * Thrown when a chunk payload fails to decompress or is not a valid document.
 */
public class CorruptPayloadException extends IOException {

    public CorruptPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
