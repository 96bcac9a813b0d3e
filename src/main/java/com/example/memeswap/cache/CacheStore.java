package com.example.memeswap.cache;

import java.util.Optional;

/**
 * Backing store of the result cache.  Holds at most one entry; TTL and
 * single-flight semantics live in {@link ResultCache}, not here.
 */
public interface CacheStore {

    Optional<CacheEntry> load();

    void save(CacheEntry entry);

    void clear();
}
