package com.example.memeswap.cache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Process-local store; contents are lost on restart. */
public class InMemoryCacheStore implements CacheStore {

    private final AtomicReference<CacheEntry> entry = new AtomicReference<>();

    @Override
    public Optional<CacheEntry> load() {
        return Optional.ofNullable(entry.get());
    }

    @Override
    public void save(CacheEntry e) {
        entry.set(e);
    }

    @Override
    public void clear() {
        entry.set(null);
    }
}
