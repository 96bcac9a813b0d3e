package com.example.memeswap.cache;

import com.example.memeswap.support.MutableClock;
import com.example.memeswap.transform.TransformOutcome;
import com.example.memeswap.transform.TransformResult;
import com.example.memeswap.trend.Candidate;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResultCacheTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration TTL = Duration.ofHours(24);

    private final MutableClock clock = new MutableClock(T0);

    private static TransformResult ok(String id) {
        return TransformResult.success(new Candidate(id, id, "g", 1, false, "https://i.redd.it/" + id + ".jpg"),
                "/artifacts/" + id + ".jpg");
    }

    private static List<String> ids(CacheEntry e) {
        return e.payload().stream().map(r -> r.sourceCandidate().identityKey()).toList();
    }

    @Test
    void absentUntilFirstPut() {
        ResultCache cache = new ResultCache(new InMemoryCacheStore(), clock, TTL);

        assertThat(cache.get()).isEmpty();
        assertThat(cache.getStaleFallback()).isEmpty();
        assertThat(cache.status(false).present()).isFalse();
    }

    @Test
    void validStrictlyBeforeTtl() {
        ResultCache cache = new ResultCache(new InMemoryCacheStore(), clock, TTL);
        cache.put(List.of(ok("a")));

        clock.advance(TTL.minusNanos(1));
        assertThat(cache.get()).isPresent();

        clock.set(T0.plus(TTL));
        assertThat(cache.get()).as("exactly at expiry").isEmpty();
        assertThat(cache.getStaleFallback()).map(ResultCacheTest::ids).contains(List.of("a"));
    }

    @Test
    void putReplacesAndRestampsEntry() {
        ResultCache cache = new ResultCache(new InMemoryCacheStore(), clock, TTL);
        cache.put(List.of(ok("a")));
        clock.advance(TTL.plusHours(1));

        cache.put(List.of(ok("b"), ok("c")));

        CacheEntry e = cache.get().orElseThrow();
        assertThat(ids(e)).containsExactly("b", "c");
        assertThat(e.createdAt()).isEqualTo(T0.plus(TTL).plus(Duration.ofHours(1)));
        assertThat(e.ttl()).isEqualTo(TTL);
    }

    @Test
    void invalidateThenGetIsAbsentAndPutRestores() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        ResultCache cache = new ResultCache(store, clock, TTL);
        cache.put(List.of(ok("a")));

        cache.invalidate();

        assertThat(cache.get()).isEmpty();
        assertThat(cache.getStaleFallback()).as("old value kept for degraded serving").isPresent();
        assertThat(store.load()).isEmpty();
        assertThat(cache.status(false).present()).isFalse();

        cache.put(List.of(ok("b")));
        assertThat(cache.get()).map(ResultCacheTest::ids).contains(List.of("b"));
    }

    @Test
    void onlySuccessesAreStored() {
        ResultCache cache = new ResultCache(new InMemoryCacheStore(), clock, TTL);
        Candidate c = new Candidate("x", "x", "g", 1, false, "u");

        cache.put(List.of(ok("a"), TransformResult.failure(c, TransformOutcome.NO_FACE_DETECTED, "none")));

        assertThat(ids(cache.get().orElseThrow())).containsExactly("a");
    }

    @Test
    void restoresFromStoreOnStartup() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.save(new CacheEntry(List.of(ok("persisted")), T0.minus(Duration.ofHours(1)), TTL));

        ResultCache cache = new ResultCache(store, clock, TTL);

        assertThat(cache.get()).map(ResultCacheTest::ids).contains(List.of("persisted"));
        assertThat(cache.status(false).ageSeconds()).isEqualTo(3600);
    }

    @Test
    void storeFailureDoesNotLoseTheValue() {
        CacheStore broken = new CacheStore() {
            @Override
            public Optional<CacheEntry> load() {
                return Optional.empty();
            }

            @Override
            public void save(CacheEntry entry) {
                throw new IllegalStateException("read-only filesystem");
            }

            @Override
            public void clear() {
                throw new IllegalStateException("read-only filesystem");
            }
        };
        ResultCache cache = new ResultCache(broken, clock, TTL);

        cache.put(List.of(ok("a")));
        assertThat(cache.get()).isPresent();

        cache.invalidate();
        assertThat(cache.get()).isEmpty();
    }

    @Test
    void statusReflectsExpiry() {
        ResultCache cache = new ResultCache(new InMemoryCacheStore(), clock, TTL);
        cache.put(List.of(ok("a"), ok("b")));
        clock.advance(Duration.ofHours(25));

        CacheStatus s = cache.status(true);

        assertThat(s.present()).isTrue();
        assertThat(s.valid()).isFalse();
        assertThat(s.size()).isEqualTo(2);
        assertThat(s.ageSeconds()).isEqualTo(25 * 3600);
        assertThat(s.fallbackAvailable()).isTrue();
        assertThat(s.regenerating()).isTrue();
    }
}
