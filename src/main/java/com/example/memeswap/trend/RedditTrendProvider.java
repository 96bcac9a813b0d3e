package com.example.memeswap.trend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link TrendProvider} backed by Reddit's public JSON listings.
 * Listing children look like {@code data.children[].data.{id,title,url,score,over_18}}.
 * Errors are not swallowed here; the candidate source decides how a failed
 * group is handled.
 */
@Component
public class RedditTrendProvider implements TrendProvider {
    private static final Logger log = LoggerFactory.getLogger(RedditTrendProvider.class);

    private final WebClient webClient;
    private final ObjectMapper mapper;

    public RedditTrendProvider(@Qualifier("trendWebClient") WebClient webClient, ObjectMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    public String id() {
        return "reddit";
    }

    @Override
    public Mono<List<RawTrendItem>> hot(String group, int limit) {
        return webClient.get()
                .uri(u -> u.path("/r/{group}/hot.json")
                        .queryParam("limit", Math.max(1, limit))
                        .queryParam("raw_json", 1)
                        .build(group))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .map(body -> parseListing(body, limit));
    }

    @Override
    public Mono<List<RawTrendItem>> search(String group, String query, int limit) {
        return webClient.get()
                .uri(u -> u.path("/r/{group}/search.json")
                        .queryParam("q", query)
                        .queryParam("restrict_sr", 1)
                        .queryParam("limit", Math.max(1, limit))
                        .queryParam("raw_json", 1)
                        .build(group))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .map(body -> parseListing(body, limit));
    }

    List<RawTrendItem> parseListing(String body, int limit) {
        if (body == null || body.isBlank()) return List.of();
        JsonNode children;
        try {
            children = mapper.readTree(body).path("data").path("children");
        } catch (Exception e) {
            throw new IllegalStateException("Malformed listing from " + id(), e);
        }
        if (!children.isArray()) return List.of();
        List<RawTrendItem> out = new ArrayList<>();
        for (JsonNode child : children) {
            JsonNode d = child.path("data");
            String id = d.path("id").asText("");
            String url = d.path("url").asText("");
            if (id.isEmpty() || url.isEmpty()) {
                log.debug("[TREND] skipping listing child without id/url");
                continue;
            }
            out.add(new RawTrendItem(
                    id,
                    d.path("title").asText(""),
                    url,
                    d.path("score").asDouble(0.0),
                    d.path("over_18").asBoolean(false)));
            if (out.size() >= limit) break;
        }
        return out;
    }
}
