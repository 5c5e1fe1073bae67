package com.deckrouter.controller;

import com.deckrouter.model.dto.CacheStatistics;
import com.deckrouter.service.embedding.EmbeddingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Embedding cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final EmbeddingCache embeddingCache;

    public CacheController(EmbeddingCache embeddingCache) {
        this.embeddingCache = embeddingCache;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(embeddingCache.stats());
    }

    /**
     * Clear both embedding caches. Entries are recomputed lazily.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        embeddingCache.invalidateAll();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Tool and query embedding caches cleared"
        ));
    }
}
