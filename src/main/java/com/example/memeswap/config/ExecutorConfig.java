package com.example.memeswap.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * Worker pools of the pipeline.  The transform pool is fixed-size so the
 * detect/swap calls never contend beyond {@code meme.transform.pool-size};
 * regeneration runs on its own thread so a reader that gives up waiting
 * never takes the regeneration down with it.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "transformExecutor", destroyMethod = "shutdownNow")
    public ExecutorService transformExecutor(TransformProperties props) {
        return Executors.newFixedThreadPool(props.getPoolSize(), named("transform"));
    }

    @Bean(name = "regenerationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService regenerationExecutor() {
        return Executors.newCachedThreadPool(named("regen"));
    }

    static ThreadFactory named(String prefix) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(true)
                .build();
    }
}
