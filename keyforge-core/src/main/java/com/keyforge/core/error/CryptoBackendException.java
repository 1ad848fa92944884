package com.keyforge.core.error;

public class CryptoBackendException extends KeyforgeException {

    public CryptoBackendException(String message) {
        super(message);
    }

    public CryptoBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
