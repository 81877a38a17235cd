package com.lexgate.core.scanner;

/**
 * Raised when a detector cannot run against a file; the scan records it and moves on.
 */
public class DetectorException extends RuntimeException {
    public DetectorException(String message) {
        super(message);
    }

    public DetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
