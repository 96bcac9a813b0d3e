package com.example.memeswap.cache;

import com.example.memeswap.config.ResultCacheProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

@Configuration
public class ResultCacheConfig {

    static final String BATCH_KEY = "homepage-batch";

    @Bean
    public CacheStore resultCacheStore(ResultCacheProperties props, ObjectMapper mapper) {
        return switch (props.getBackend()) {
            case FILE -> new FileCacheStore(props.getFile(), mapper);
            case MEMORY -> new InMemoryCacheStore();
        };
    }

    @Bean
    public ResultCache resultCache(CacheStore resultCacheStore, Clock clock, ResultCacheProperties props) {
        return new ResultCache(resultCacheStore, clock, props.getTtl());
    }

    @Bean
    public RegenerationGuard regenerationGuard(@Qualifier("regenerationExecutor") ExecutorService executor) {
        return new RegenerationGuard(BATCH_KEY, executor);
    }
}
