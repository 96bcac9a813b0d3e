package com.example.memeswap.cache;

import com.example.memeswap.transform.TransformResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-entry TTL cache of the last successful batch.
 *
 * <pre>
 *   ABSENT --put--&gt; VALID --ttl elapses--&gt; EXPIRED --put--&gt; VALID ...
 *   VALID | EXPIRED --invalidate--&gt; ABSENT
 * </pre>
 * An expired or invalidated entry is not returned by {@link #get()} but
 * stays available through {@link #getStaleFallback()} until the next
 * {@link #put}, so there is never a moment with nothing to serve once a
 * first batch exists.  Reads are lock-free; writes are serialised so the
 * backing store sees them in the same order as readers do.
 */
@Slf4j
public class ResultCache {

    private record Held(CacheEntry entry, boolean invalidated) {
    }

    private final CacheStore store;
    private final Clock clock;
    private final Duration ttl;
    private final AtomicReference<Held> current = new AtomicReference<>();
    private final Object writeLock = new Object();

    public ResultCache(CacheStore store, Clock clock, Duration ttl) {
        this.store = store;
        this.clock = clock;
        this.ttl = ttl;
        store.load().ifPresent(e -> {
            current.set(new Held(e, false));
            log.info("[CACHE] restored {} item(s) created at {}", e.payload().size(), e.createdAt());
        });
    }

    /** The current entry if it is neither invalidated nor expired. */
    public Optional<CacheEntry> get() {
        Held h = current.get();
        if (h == null || h.invalidated()) return Optional.empty();
        return h.entry().isValidAt(clock.instant()) ? Optional.of(h.entry()) : Optional.empty();
    }

    /** The most recent entry regardless of expiry or invalidation. */
    public Optional<CacheEntry> getStaleFallback() {
        Held h = current.get();
        return h == null ? Optional.empty() : Optional.of(h.entry());
    }

    /**
     * Replaces the current entry with one stamped now.  A failure to persist
     * is logged; the in-memory value is still replaced.
     */
    public CacheEntry put(List<TransformResult> payload) {
        List<TransformResult> successes = payload.stream().filter(TransformResult::isSuccess).toList();
        CacheEntry entry = new CacheEntry(successes, clock.instant(), ttl);
        synchronized (writeLock) {
            current.set(new Held(entry, false));
            try {
                store.save(entry);
            } catch (RuntimeException e) {
                log.warn("[CACHE] persisting entry failed, serving from memory only", e);
            }
        }
        log.info("[CACHE] stored {} item(s), ttl={}", successes.size(), ttl);
        return entry;
    }

    /** Forces the next {@link #get()} to miss; the old entry remains the stale fallback. */
    public void invalidate() {
        synchronized (writeLock) {
            current.updateAndGet(h -> h == null ? null : new Held(h.entry(), true));
            try {
                store.clear();
            } catch (RuntimeException e) {
                log.warn("[CACHE] clearing backing store failed", e);
            }
        }
        log.info("[CACHE] invalidated");
    }

    public CacheStatus status(boolean regenerating) {
        Held h = current.get();
        if (h == null) {
            return new CacheStatus(false, false, -1, 0, null, false, regenerating);
        }
        Instant now = clock.instant();
        CacheEntry e = h.entry();
        boolean present = !h.invalidated();
        return new CacheStatus(
                present,
                present && e.isValidAt(now),
                e.age(now).toSeconds(),
                e.payload().size(),
                e.createdAt(),
                true,
                regenerating);
    }

    public Duration ttl() {
        return ttl;
    }
}
