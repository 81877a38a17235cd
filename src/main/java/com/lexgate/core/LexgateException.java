package com.lexgate.core;

/**
 * Thrown when a whole stage cannot proceed, typically because its inputs are unreadable.
 */
public class LexgateException extends RuntimeException {
    public LexgateException(String message) {
        super(message);
    }

    public LexgateException(String message, Throwable cause) {
        super(message, cause);
    }
}
