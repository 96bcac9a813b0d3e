package com.example.memeswap.service;

import com.example.memeswap.cache.CacheEntry;
import com.example.memeswap.transform.TransformResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

public record BatchView(BatchStatus status,
                        List<TransformResult> items,
                        Instant createdAt,
                        long ageSeconds,
                        boolean regenerating) {

    static BatchView of(BatchStatus status, CacheEntry entry, Clock clock, boolean regenerating) {
        return new BatchView(status, entry.payload(), entry.createdAt(),
                entry.age(clock.instant()).toSeconds(), regenerating);
    }

    static BatchView nothing(BatchStatus status, boolean regenerating) {
        return new BatchView(status, List.of(), null, -1, regenerating);
    }
}
