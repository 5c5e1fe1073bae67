package com.deckrouter.config;

import com.deckrouter.model.EmbeddingEntry;
import com.deckrouter.service.embedding.EmbeddingCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine configuration for the tool and query embedding caches.
 */
@Configuration
public class CacheConfiguration {

    private final DeckRouterProperties properties;

    public CacheConfiguration(DeckRouterProperties properties) {
        this.properties = properties;
    }

    @Bean
    public EmbeddingCache embeddingCache() {
        DeckRouterProperties.CacheConfig config = properties.getCache();
        return new EmbeddingCache(
                caffeineCache(config.getMaxToolEntries(), config.getExpireAfterAccess()),
                caffeineCache(config.getMaxQueryEntries(), config.getExpireAfterAccess()));
    }

    private Cache<String, EmbeddingEntry> caffeineCache(int maxSize, Duration expireAfterAccess) {
        return Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterAccess(expireAfterAccess)
                .build();
    }
}
