package com.deckrouter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for Deck Router.
 */
@Data
@Component
@ConfigurationProperties(prefix = "deckrouter")
public class DeckRouterProperties {

    private EmbeddingsConfig embeddings = new EmbeddingsConfig();
    private CacheConfig cache = new CacheConfig();
    private RoutingConfig routing = new RoutingConfig();
    private MatchingConfig matching = new MatchingConfig();

    @Data
    public static class EmbeddingsConfig {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "text-embedding-3-small";
        private Duration timeout = Duration.ofSeconds(10);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class CacheConfig {
        private int maxToolEntries = 1000;
        private int maxQueryEntries = 5000;
        private Duration expireAfterAccess = Duration.ofHours(24);
    }

    @Data
    public static class RoutingConfig {
        /** Minimum score to auto-run the best tool. */
        private double executeThreshold = 0.7;
        /** Minimum score for a tool to be offered in a disambiguation prompt. */
        private double rankThreshold = 0.55;
        private int maxOptions = 3;
        private boolean queryExpansionEnabled = true;
        private boolean canHandleFilter = false;
        private int fetchPoolCeiling = 8;
        private Duration perItemTimeout = Duration.ofSeconds(15);
        private boolean preloadToolEmbeddings = true;
        private String expansionsLocation = "classpath:routing/query-expansions.json";
        private String catalogLocation = "classpath:tools/catalog.json";
    }

    @Data
    public static class MatchingConfig {
        private double threshold = 0.5;
        /** Entity kind name (e.g. PLANT) to alias CSV path. */
        private Map<String, String> aliasTables = new LinkedHashMap<>();
        private char aliasDelimiter = ',';
    }
}
