package com.example.memeswap.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Result cache settings.  {@code contentionPolicy} decides what a reader
 * does when it finds the cache expired while another reader is already
 * regenerating it.
 */
@Getter
@Setter
@ConfigurationProperties("meme.cache")
public class ResultCacheProperties {

    public enum Backend { MEMORY, FILE }

    public enum ContentionPolicy {
        /** Block until the running regeneration completes, bounded by {@code waitTimeout}. */
        WAIT,
        /** Return the stale fallback at once when one exists. */
        SERVE_STALE
    }

    private Duration ttl = Duration.ofHours(24);

    private Backend backend = Backend.FILE;

    private Path file = Path.of("static", "meme_cache.json");

    private ContentionPolicy contentionPolicy = ContentionPolicy.WAIT;

    private Duration waitTimeout = Duration.ofSeconds(120);

    private Warmup warmup = new Warmup();

    @Getter
    @Setter
    public static class Warmup {
        private boolean enabled = false;
        private long initialDelayMs = 30_000;
        private long periodMs = 600_000;
    }
}
