package com.example.memeswap.cache;

import com.example.memeswap.transform.TransformResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One generation's successful results.  Never mutated: the next successful
 * generation supersedes it with a new entry.
 */
public record CacheEntry(List<TransformResult> payload, Instant createdAt, Duration ttl) {

    public CacheEntry {
        payload = List.copyOf(payload);
    }

    /** Valid while {@code now - createdAt < ttl}; the expiry instant itself is already expired. */
    public boolean isValidAt(Instant now) {
        return age(now).compareTo(ttl) < 0;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }
}
