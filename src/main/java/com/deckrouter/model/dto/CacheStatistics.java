package com.deckrouter.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Embedding cache statistics for the cache endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Tool embeddings currently cached.
     */
    @JsonProperty("tool_entries")
    private long toolEntries;

    /**
     * Query embeddings currently cached.
     */
    @JsonProperty("query_entries")
    private long queryEntries;

    private long hits;

    private long misses;

    /**
     * Hit rate (0.0-1.0) since startup.
     */
    @JsonProperty("hit_rate")
    private double hitRate;
}
