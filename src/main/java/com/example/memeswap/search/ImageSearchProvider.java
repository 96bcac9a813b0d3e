package com.example.memeswap.search;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Free-text image lookup.  Implementations resolve to an empty list rather
 * than an error when the upstream has nothing or is unreachable.
 */
public interface ImageSearchProvider {

    String id();

    /** Image URLs for the query, at most {@code limit}; no ordering guarantee. */
    Mono<List<String>> search(String query, int limit);
}
