package com.eainde.sos.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * At most one in-flight computation per key. Concurrent callers for the same
 * key share the leader's future; different keys never wait on each other.
 *
 * <p>Slots are created lazily and removed before the shared future completes,
 * so the map only ever holds keys with work in flight.</p>
 */
public class SingleFlight<V> {

    private static final Logger log = LoggerFactory.getLogger(SingleFlight.class);

    private final ConcurrentHashMap<String, CompletableFuture<V>> inflight = new ConcurrentHashMap<>();
    private final Executor executor;

    public SingleFlight(Executor executor) {
        this.executor = executor;
    }

    /**
     * Starts {@code supplier} on the executor unless a computation for {@code key}
     * is already running, in which case the running one is joined.
     * Cancelling the returned future does not stop the computation.
     */
    public CompletableFuture<V> run(String key, Supplier<V> supplier) {
        CompletableFuture<V> created = new CompletableFuture<>();
        CompletableFuture<V> existing = inflight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("Joining in-flight computation for {}", key);
            return existing.thenApply(v -> v);
        }

        try {
            executor.execute(() -> {
                V value;
                try {
                    value = supplier.get();
                } catch (Throwable t) {
                    inflight.remove(key, created);
                    created.completeExceptionally(t);
                    return;
                }
                inflight.remove(key, created);
                created.complete(value);
            });
        } catch (RejectedExecutionException e) {
            inflight.remove(key, created);
            created.completeExceptionally(e);
        }
        return created.thenApply(v -> v);
    }

    public boolean isInFlight(String key) {
        return inflight.containsKey(key);
    }

    public int inFlightCount() {
        return inflight.size();
    }
}
