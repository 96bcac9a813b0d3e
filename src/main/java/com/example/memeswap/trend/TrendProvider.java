package com.example.memeswap.trend;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External source of ranked candidate items.  Implementations may fail or be
 * rate limited; callers treat either as "try again next cycle".
 */
public interface TrendProvider {

    String id();

    /** Up to {@code limit} currently popular items of one group. */
    Mono<List<RawTrendItem>> hot(String group, int limit);

    /** Up to {@code limit} items of one group matching a free-text query. */
    Mono<List<RawTrendItem>> search(String group, String query, int limit);
}
