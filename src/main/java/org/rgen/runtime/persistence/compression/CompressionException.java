package org.rgen.runtime.persistence.compression;

/**
 * Raised when a compression codec cannot be used in the current environment.
 */
public class CompressionException extends Exception {

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
