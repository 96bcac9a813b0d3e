package com.example.memeswap.trend;

import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Canned listings per group; counts subscriptions. */
class StubTrendProvider implements TrendProvider {

    private final Map<String, Mono<List<RawTrendItem>>> hot = new HashMap<>();
    private final Map<String, Mono<List<RawTrendItem>>> search = new HashMap<>();
    final AtomicInteger calls = new AtomicInteger();

    StubTrendProvider hot(String group, RawTrendItem... items) {
        hot.put(group, Mono.just(List.of(items)));
        return this;
    }

    StubTrendProvider hot(String group, Mono<List<RawTrendItem>> response) {
        hot.put(group, response);
        return this;
    }

    StubTrendProvider search(String group, RawTrendItem... items) {
        search.put(group, Mono.just(List.of(items)));
        return this;
    }

    @Override
    public String id() {
        return "stub";
    }

    @Override
    public Mono<List<RawTrendItem>> hot(String group, int limit) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            return hot.getOrDefault(group, Mono.just(List.of()));
        });
    }

    @Override
    public Mono<List<RawTrendItem>> search(String group, String query, int limit) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            return search.getOrDefault(group, Mono.just(List.of()));
        });
    }

    static RawTrendItem item(String id, String title, double score) {
        return new RawTrendItem(id, title, "https://i.redd.it/" + id + ".jpg", score, false);
    }
}
