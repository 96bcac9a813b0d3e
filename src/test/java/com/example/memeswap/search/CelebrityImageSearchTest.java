package com.example.memeswap.search;

import com.example.memeswap.config.SearchProperties;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CelebrityImageSearchTest {

    private static ImageSearchProvider fixed(String id, List<String> urls, AtomicInteger calls) {
        return new ImageSearchProvider() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Mono<List<String>> search(String query, int limit) {
                calls.incrementAndGet();
                return Mono.just(urls.size() > limit ? urls.subList(0, limit) : urls);
            }
        };
    }

    @Test
    void fallbackNotAskedWhenPrimaryHasEnough() {
        AtomicInteger fallbackCalls = new AtomicInteger();
        CelebrityImageSearch search = new CelebrityImageSearch(
                fixed("p", List.of("u1", "u2", "u3", "u4", "u5"), new AtomicInteger()),
                fixed("f", List.of("f1"), fallbackCalls),
                new SearchProperties());

        assertThat(search.find("Someone")).containsExactly("u1", "u2", "u3", "u4", "u5");
        assertThat(fallbackCalls.get()).isZero();
    }

    @Test
    void fallbackTopsUpWithoutDuplicates() {
        CelebrityImageSearch search = new CelebrityImageSearch(
                fixed("p", List.of("u1", "u2"), new AtomicInteger()),
                fixed("f", List.of("u2", "f1"), new AtomicInteger()),
                new SearchProperties());

        assertThat(search.find("Someone")).containsExactly("u1", "u2", "f1");
    }

    @Test
    void resultIsCapped() {
        SearchProperties props = new SearchProperties();
        props.setMaxResults(3);
        props.setMinPrimaryResults(5);
        CelebrityImageSearch search = new CelebrityImageSearch(
                fixed("p", List.of("u1", "u2"), new AtomicInteger()),
                fixed("f", List.of("f1", "f2", "f3"), new AtomicInteger()),
                props);

        assertThat(search.find("Someone")).containsExactly("u1", "u2", "f1");
    }

    @Test
    void blankNameFindsNothing() {
        AtomicInteger calls = new AtomicInteger();
        CelebrityImageSearch search = new CelebrityImageSearch(
                fixed("p", List.of("u1"), calls), fixed("f", List.of(), calls), new SearchProperties());

        assertThat(search.find(" ")).isEmpty();
        assertThat(calls.get()).isZero();
    }
}
