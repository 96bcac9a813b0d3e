package com.example.memeswap.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the trend provider and the candidate source built on top of it.
 *
 * <p>The per-group limit deliberately over-fetches relative to the number of
 * images finally shown: safety filtering and failed transforms both eat into
 * the yield, so two to three times the desired count is the usual ratio.</p>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties("meme.trends")
public class TrendProperties {

    /** Listing groups (subreddits) polled for the homepage batch. */
    private List<String> groups = new ArrayList<>(List.of("wholesomememes", "memes", "aww", "funny"));

    /** Groups searched when a free-text custom query is submitted. */
    private List<String> searchGroups = new ArrayList<>(List.of("memes", "dankmemes", "wholesomememes"));

    @Min(1)
    private int perGroupLimit = 15;

    /** Cap applied after dedup and popularity sort. */
    @Min(1)
    private int maxCandidates = 20;

    /** Cap applied to free-text search results. */
    @Min(1)
    private int maxSearchResults = 10;

    /** Per-call timeout; a group that exceeds it counts as failed for this cycle. */
    private Duration timeout = Duration.ofSeconds(8);

    /** Expiry of the short-lived candidate list cache. */
    private Duration cacheTtl = Duration.ofHours(2);

    private String baseUrl = "https://www.reddit.com";

    private String userAgent = "meme-swap/0.1 (trend fetcher)";

    /** Extensions accepted as static raster images. */
    private List<String> allowedExtensions = new ArrayList<>(List.of("jpg", "jpeg", "png"));

    /** Hosts that only serve raster images even when the path carries no extension. */
    private List<String> imageHosts = new ArrayList<>(List.of("i.redd.it", "i.imgur.com"));
}
