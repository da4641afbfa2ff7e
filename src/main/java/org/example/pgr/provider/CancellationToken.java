package org.example.pgr.provider;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Cooperative cancellation signal for one resolution.
 *
 * <p>Observed at every point where the resolver waits for a provider result: a cancelled
 * token makes {@link #await(CompletableFuture)} throw {@link CancellationException} without
 * waiting for the pending query.</p>
 */
public class CancellationToken {

    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    /**
     * Creates a token that has not been cancelled.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Resolution was cancelled");
        }
    }

    /**
     * Waits for a future, returning early if this token is cancelled.
     *
     * @throws ExecutionException    if the future completed exceptionally
     * @throws CancellationException if the token was cancelled before or while waiting
     */
    public <T> T await(CompletableFuture<T> future) throws ExecutionException {
        throwIfCancelled();
        try {
            CompletableFuture.anyOf(future, cancelled).handle((result, error) -> null).get();
            throwIfCancelled();
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new CancellationException("Interrupted while waiting for a provider");
        }
    }
}
