package com.keyforge.core.error;

/**
 * Work was submitted after the worker pool began shutting down.
 */
public class PoolClosedException extends KeyforgeException {

    public PoolClosedException(String message) {
        super(message);
    }
}
