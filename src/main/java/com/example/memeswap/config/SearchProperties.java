package com.example.memeswap.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Image search providers used for celebrity lookups.  Wikimedia is asked
 * first; DuckDuckGo only tops up when Wikimedia found fewer than
 * {@code minPrimaryResults} images.
 */
@Getter
@Setter
@ConfigurationProperties("meme.search")
public class SearchProperties {

    private String wikimediaBaseUrl = "https://en.wikipedia.org";

    private String duckduckgoBaseUrl = "https://api.duckduckgo.com";

    private String userAgent = "meme-swap/0.1 (image search)";

    private Duration timeout = Duration.ofSeconds(10);

    private int minPrimaryResults = 5;

    private int maxResults = 10;

    /** Page images whose title contains one of these are not portraits. */
    private List<String> excludedTitleTerms = new ArrayList<>(List.of(
            "icon", "logo", "signature", "flag", "map", "chart", "diagram"));
}
