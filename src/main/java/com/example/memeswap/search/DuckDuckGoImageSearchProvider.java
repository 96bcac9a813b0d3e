package com.example.memeswap.search;

import com.example.memeswap.config.SearchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * DuckDuckGo instant answers: the abstract's image plus the icons of related
 * topics.  Few results and often small, so only used to top up.
 */
@Slf4j
@Component
public class DuckDuckGoImageSearchProvider implements ImageSearchProvider {

    private static final String SITE = "https://duckduckgo.com";

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final SearchProperties props;

    public DuckDuckGoImageSearchProvider(@Qualifier("duckduckgoWebClient") WebClient webClient,
                                         ObjectMapper mapper,
                                         SearchProperties props) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.props = props;
    }

    @Override
    public String id() {
        return "duckduckgo";
    }

    @Override
    public Mono<List<String>> search(String query, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return Mono.just(List.of());
        }
        return webClient.get()
                .uri(b -> b.path("/")
                        .queryParam("q", query.trim())
                        .queryParam("format", "json")
                        .queryParam("no_html", 1)
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .map(body -> parse(body, limit))
                .timeout(props.getTimeout())
                .onErrorResume(ex -> {
                    log.warn("[SEARCH] duckduckgo lookup '{}' failed: {}", query, ex.toString());
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }

    List<String> parse(String body, int limit) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "{}" : body);
        } catch (IOException e) {
            throw new IllegalStateException("unparseable instant answer", e);
        }
        List<String> out = new ArrayList<>();
        addIfImage(out, root.path("Image").asText(""));
        for (JsonNode topic : root.path("RelatedTopics")) {
            addIfImage(out, topic.path("Icon").path("URL").asText(""));
        }
        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : out;
    }

    private static void addIfImage(List<String> out, String url) {
        if (url.isBlank() || url.endsWith(".ico")) return;
        out.add(url.startsWith("/") ? SITE + url : url);
    }
}
