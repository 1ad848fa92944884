package com.keyforge.core.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for surfacing the typed cause of asynchronous failures.
 */
public final class Failures {

    private Failures() {
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns the unwrapped cause as a {@link KeyforgeException}, wrapping foreign errors.
     */
    public static KeyforgeException asKeyforge(Throwable throwable, String context) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof KeyforgeException keyforge) {
            return keyforge;
        }
        return new KeyforgeException(context + ": " + cause.getMessage(), cause);
    }
}
