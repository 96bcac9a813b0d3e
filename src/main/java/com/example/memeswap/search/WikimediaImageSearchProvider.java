package com.example.memeswap.search;

import com.example.memeswap.config.SearchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Wikipedia page images.  Three calls against the MediaWiki action API:
 * find the best matching page, list the files it embeds, then resolve the
 * photo-like ones to their upload URLs until {@code limit} are found.
 */
@Slf4j
@Component
public class WikimediaImageSearchProvider implements ImageSearchProvider {

    private static final List<String> PHOTO_EXTENSIONS = List.of(".jpg", ".jpeg", ".png");

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final SearchProperties props;

    public WikimediaImageSearchProvider(@Qualifier("wikimediaWebClient") WebClient webClient,
                                        ObjectMapper mapper,
                                        SearchProperties props) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.props = props;
    }

    @Override
    public String id() {
        return "wikimedia";
    }

    @Override
    public Mono<List<String>> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return Mono.just(List.of());
        }
        return get(b -> b.queryParam("list", "search")
                        .queryParam("srsearch", query.trim())
                        .queryParam("srlimit", 1))
                .flatMap(body -> Mono.justOrEmpty(firstSearchTitle(body)))
                .flatMap(title -> get(b -> b.queryParam("titles", title)
                        .queryParam("prop", "images")
                        .queryParam("imlimit", 50)))
                .map(body -> photoTitles(body, props.getExcludedTitleTerms()))
                .flatMapMany(Flux::fromIterable)
                .concatMap(file -> get(b -> b.queryParam("titles", file)
                                .queryParam("prop", "imageinfo")
                                .queryParam("iiprop", "url"))
                        .flatMap(body -> Mono.justOrEmpty(imageUrl(body))))
                .take(limit)
                .collectList()
                .timeout(props.getTimeout().multipliedBy(3))
                .onErrorResume(ex -> {
                    log.warn("[SEARCH] wikimedia lookup '{}' failed: {}", query, ex.toString());
                    return Mono.just(List.of());
                });
    }

    private Mono<String> get(UnaryOperator<UriBuilder> params) {
        return webClient.get()
                .uri(b -> params.apply(b.path("/w/api.php")
                                .queryParam("action", "query")
                                .queryParam("format", "json"))
                        .build())
                .retrieve()
                .bodyToMono(String.class);
    }

    Optional<String> firstSearchTitle(String body) {
        JsonNode hits = read(body).path("query").path("search");
        if (!hits.isArray() || hits.isEmpty()) return Optional.empty();
        String title = hits.get(0).path("title").asText(null);
        return Optional.ofNullable(title);
    }

    List<String> photoTitles(String body, List<String> excluded) {
        List<String> out = new ArrayList<>();
        for (JsonNode page : read(body).path("query").path("pages")) {
            for (JsonNode image : page.path("images")) {
                String title = image.path("title").asText("");
                String lower = title.toLowerCase(Locale.ROOT);
                if (PHOTO_EXTENSIONS.stream().noneMatch(lower::contains)) continue;
                if (excluded.stream().anyMatch(t -> lower.contains(t.toLowerCase(Locale.ROOT)))) continue;
                out.add(title);
            }
            break;
        }
        return out;
    }

    Optional<String> imageUrl(String body) {
        for (JsonNode page : read(body).path("query").path("pages")) {
            JsonNode info = page.path("imageinfo");
            if (info.isArray() && !info.isEmpty()) {
                String url = info.get(0).path("url").asText("");
                if (!url.isBlank()) return Optional.of(url);
            }
        }
        return Optional.empty();
    }

    private JsonNode read(String body) {
        try {
            return mapper.readTree(body == null ? "{}" : body);
        } catch (IOException e) {
            throw new IllegalStateException("unparseable MediaWiki response", e);
        }
    }
}
