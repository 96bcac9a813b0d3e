package com.example.memeswap.cache;

import java.time.Instant;

/**
 * Snapshot of the cache for status reporting.
 *
 * @param present          a current (not invalidated) entry exists, expired or not
 * @param valid            {@link ResultCache#get()} would return it
 * @param ageSeconds       age of the held entry, {@code -1} when none is held
 * @param size             items in the held entry
 * @param fallbackAvailable a stale entry could be served
 * @param regenerating     a regeneration is in flight
 */
public record CacheStatus(boolean present,
                          boolean valid,
                          long ageSeconds,
                          int size,
                          Instant createdAt,
                          boolean fallbackAvailable,
                          boolean regenerating) {
}
