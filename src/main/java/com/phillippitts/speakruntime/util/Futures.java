package com.phillippitts.speakruntime.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for hook futures.
 */
public final class Futures {

    private Futures() {
        // Utility class - prevent instantiation
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Calls a hook that returns a future. A {@code null} result counts as completed; a
     * synchronous throw becomes a failed future.
     */
    public static CompletableFuture<Void> invokeHook(Supplier<CompletableFuture<Void>> hook) {
        try {
            CompletableFuture<Void> future = hook.get();
            return future == null ? CompletableFuture.completedFuture(null) : future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
