package com.replication.binlogsync.schema;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Collapses concurrent calls for the same key into a single execution.
 * <p>
 * The first caller for a key runs the callable; callers arriving while it is in
 * flight wait for it and receive the same value or the same failure. The key is
 * forgotten as soon as the call completes, so neither values nor failures are
 * remembered between calls.
 */
public class SingleFlight<K, V> {
    private final Map<K, CompletableFuture<V>> calls;

    public SingleFlight() {
        this.calls = new ConcurrentHashMap<>();
    }

    /**
     * @throws ExecutionException   wrapping whatever the callable threw
     * @throws InterruptedException if interrupted while waiting for another caller's execution
     */
    public V execute(K key, Callable<V> callable) throws ExecutionException, InterruptedException {
        CompletableFuture<V> call = new CompletableFuture<>();
        CompletableFuture<V> inFlight = this.calls.putIfAbsent(key, call);

        if (inFlight != null) {
            return inFlight.get();
        }

        try {
            call.complete(callable.call());
        } catch (Throwable throwable) {
            call.completeExceptionally(throwable);
        } finally {
            this.calls.remove(key, call);
        }

        return call.get();
    }

    public boolean isInFlight(K key) {
        return this.calls.containsKey(key);
    }
}
