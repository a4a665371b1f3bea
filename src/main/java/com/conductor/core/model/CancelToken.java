package com.conductor.core.model;

import java.util.concurrent.CompletableFuture;

/**
 * One-shot cancellation signal shared between the requester and the job's worker.
 * The first {@link #cancel(String)} wins; later calls are ignored.
 */
public final class CancelToken {

    private final CompletableFuture<String> signal = new CompletableFuture<>();

    /**
     * @return true if this call fired the token, false if it was already fired
     */
    public boolean cancel(String reason) {
        return signal.complete(reason == null || reason.isBlank() ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /** Reason given to the first cancel call, or null while not cancelled. */
    public String reason() {
        return signal.getNow(null);
    }

    /**
     * Future completing with the reason when the token fires. Completing the
     * returned copy does not fire the token.
     */
    public CompletableFuture<String> asFuture() {
        return signal.copy();
    }
}
