package com.example.memeswap.cache;

import com.example.memeswap.infra.cache.SingleFlightExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lets exactly one caller regenerate a cache key at a time.  The
 * regeneration runs on its own executor: callers that stop waiting, or
 * disconnect, do not stop it, and its result still lands in the cache.
 */
@Slf4j
public class RegenerationGuard {

    private final String key;
    private final SingleFlightExecutor flights;
    private final AtomicLong started = new AtomicLong();

    public RegenerationGuard(String key, Executor executor) {
        this.key = key;
        this.flights = new SingleFlightExecutor(executor);
    }

    /** Starts a regeneration, or joins the one already running. */
    public <T> SingleFlightExecutor.Flight<T> regenerate(Callable<T> task) {
        SingleFlightExecutor.Flight<T> flight = flights.execute(key, () -> {
            long n = started.incrementAndGet();
            log.info("[CACHE] regeneration #{} started for '{}'", n, key);
            return task.call();
        });
        if (!flight.leader()) {
            log.debug("[CACHE] joined running regeneration for '{}'", key);
        }
        return flight;
    }

    public boolean isRegenerating() {
        return flights.isInFlight(key);
    }

    /** Regenerations started since construction. */
    public long startedCount() {
        return started.get();
    }
}
