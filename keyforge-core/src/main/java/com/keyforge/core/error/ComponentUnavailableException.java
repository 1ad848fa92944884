package com.keyforge.core.error;

/**
 * A component failed its health ping.
 */
public class ComponentUnavailableException extends KeyforgeException {

    private final String component;

    public ComponentUnavailableException(String component, String message) {
        super(component + " unavailable: " + message);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
