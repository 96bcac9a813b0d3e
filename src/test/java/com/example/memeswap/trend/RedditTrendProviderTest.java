package com.example.memeswap.trend;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedditTrendProviderTest {

    private static final String LISTING = """
            {"data":{"children":[
              {"data":{"id":"a1","title":"Cat","url":"https://i.redd.it/a1.jpg","score":120,"over_18":false}},
              {"data":{"id":"a2","title":"Spicy","url":"https://i.redd.it/a2.png","score":80,"over_18":true}},
              {"data":{"title":"no id","url":"https://i.redd.it/x.jpg"}},
              {"data":{"id":"a3","title":"Dog","url":"https://i.imgur.com/a3.jpg","score":40}}
            ]}}
            """;

    private final AtomicReference<URI> lastUri = new AtomicReference<>();

    private RedditTrendProvider provider(HttpStatus status, String body) {
        WebClient client = WebClient.builder()
                .baseUrl("https://www.reddit.com")
                .exchangeFunction(req -> {
                    lastUri.set(req.url());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new RedditTrendProvider(client, new ObjectMapper());
    }

    @Test
    void hotParsesListingChildren() {
        List<RawTrendItem> items = provider(HttpStatus.OK, LISTING).hot("memes", 10).block();

        assertThat(items).extracting(RawTrendItem::identityKey).containsExactly("a1", "a2", "a3");
        assertThat(items.get(0).score()).isEqualTo(120.0);
        assertThat(items.get(1).flagged()).isTrue();
        assertThat(items.get(2).flagged()).isFalse();
        assertThat(lastUri.get().getPath()).isEqualTo("/r/memes/hot.json");
        assertThat(lastUri.get().getQuery()).contains("limit=10");
    }

    @Test
    void hotHonoursLimit() {
        List<RawTrendItem> items = provider(HttpStatus.OK, LISTING).hot("memes", 1).block();
        assertThat(items).hasSize(1);
    }

    @Test
    void searchIsRestrictedToGroup() {
        provider(HttpStatus.OK, LISTING).search("dankmemes", "cats", 5).block();

        assertThat(lastUri.get().getPath()).isEqualTo("/r/dankmemes/search.json");
        assertThat(lastUri.get().getQuery()).contains("q=cats").contains("restrict_sr=1");
    }

    @Test
    void httpErrorSurfacesAsError() {
        RedditTrendProvider p = provider(HttpStatus.TOO_MANY_REQUESTS, "{}");
        assertThatThrownBy(() -> p.hot("memes", 10).block())
                .isInstanceOf(WebClientResponseException.class);
    }

    @Test
    void emptyOrOddBodiesGiveEmptyList() {
        RedditTrendProvider p = provider(HttpStatus.OK, "{}");
        assertThat(p.parseListing("", 5)).isEmpty();
        assertThat(p.parseListing("{\"data\":{}}", 5)).isEmpty();
        assertThatThrownBy(() -> p.parseListing("<html>", 5)).isInstanceOf(IllegalStateException.class);
    }
}
