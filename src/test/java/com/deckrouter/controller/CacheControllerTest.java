package com.deckrouter.controller;

import com.deckrouter.model.dto.CacheStatistics;
import com.deckrouter.service.embedding.EmbeddingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheController.
 */
class CacheControllerTest {

    private EmbeddingCache cache;
    private CacheController controller;

    @BeforeEach
    void setUp() {
        cache = new EmbeddingCache(Caffeine.newBuilder().build(), Caffeine.newBuilder().build());
        controller = new CacheController(cache);
    }

    @Test
    void testStatsAndClear() {
        cache.getOrComputeTool("CTTool", "Bloco CT", text -> new float[]{1f, 0f});
        cache.getOrComputeTool("CTTool", "Bloco CT", text -> new float[]{1f, 0f});
        cache.getOrComputeQuery("cvu de angra", text -> new float[]{0f, 1f});

        CacheStatistics stats = controller.getStats().getBody();
        assertEquals(1, stats.getToolEntries());
        assertEquals(1, stats.getQueryEntries());
        assertEquals(1, stats.getHits());
        assertEquals(2, stats.getMisses());

        assertEquals("success", controller.clearCache().getBody().get("status"));
        CacheStatistics cleared = controller.getStats().getBody();
        assertEquals(0, cleared.getToolEntries());
        assertEquals(0, cleared.getQueryEntries());
    }
}
