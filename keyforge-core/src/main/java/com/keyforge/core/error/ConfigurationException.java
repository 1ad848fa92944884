package com.keyforge.core.error;

public class ConfigurationException extends KeyforgeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
