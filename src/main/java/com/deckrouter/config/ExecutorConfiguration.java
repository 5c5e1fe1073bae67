package com.deckrouter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for embedding fetches and per-deck entity lookups.
 * Sized at 2x cores, capped by {@code deckrouter.routing.fetch-pool-ceiling}.
 */
@Configuration
public class ExecutorConfiguration {

    @Bean(name = "embeddingFetchExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor embeddingFetchExecutor(DeckRouterProperties properties) {
        int ceiling = Math.max(1, properties.getRouting().getFetchPoolCeiling());
        int size = Math.min(2 * Runtime.getRuntime().availableProcessors(), ceiling);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("embedding-fetch-");
        executor.initialize();
        return executor;
    }
}
