package com.keyforge.core.error;

/**
 * Root of every error raised by the Keyforge runtime.
 */
public class KeyforgeException extends RuntimeException {

    public KeyforgeException(String message) {
        super(message);
    }

    public KeyforgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
