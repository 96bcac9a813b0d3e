package com.example.memeswap.cache;

import com.example.memeswap.service.MemeSwapService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Regenerates an expired batch in the background so readers rarely hit the
 * expired path themselves.  Goes through the same guard as readers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "meme.cache.warmup", name = "enabled", havingValue = "true")
public class CacheWarmupScheduler {

    private final MemeSwapService service;

    @Scheduled(initialDelayString = "${meme.cache.warmup.initial-delay-ms:30000}",
            fixedDelayString = "${meme.cache.warmup.period-ms:600000}")
    public void warmUp() {
        if (service.refreshIfExpired()) {
            log.info("[CACHE] warm-up started a regeneration");
        }
    }
}
