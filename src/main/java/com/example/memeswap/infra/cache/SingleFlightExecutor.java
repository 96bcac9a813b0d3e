package com.example.memeswap.infra.cache;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * At most one in-progress execution per key.  The first caller for a key
 * starts the task on the configured executor; callers arriving while it runs
 * join the same future instead of starting a second one.  The key is freed
 * once the task completes, successfully or not, so a failed flight can be
 * retried by the next caller.  It is freed before the future completes:
 * a callback on a finished flight that executes the same key starts a new
 * flight rather than joining the one that just ended.
 *
 * <p>Cancelling a returned future does not stop the task: joiners may give
 * up waiting, the flight still runs to completion.</p>
 */
public class SingleFlightExecutor {

    /** A joined or started flight. */
    public record Flight<T>(CompletableFuture<T> future, boolean leader) {
    }

    private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final Executor executor;

    public SingleFlightExecutor(Executor executor) {
        this.executor = executor;
    }

    @SuppressWarnings("unchecked")
    public <T> Flight<T> execute(String key, Callable<T> task) {
        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            return new Flight<>((CompletableFuture<T>) (CompletableFuture<?>) existing.copy(), false);
        }
        try {
            executor.execute(() -> {
                Object result;
                try {
                    result = task.call();
                } catch (Throwable t) {
                    inFlight.remove(key, created);
                    created.completeExceptionally(t);
                    return;
                }
                inFlight.remove(key, created);
                created.complete(result);
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, created);
            created.completeExceptionally(e);
        }
        return new Flight<>((CompletableFuture<T>) (CompletableFuture<?>) created.copy(), true);
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }
}
