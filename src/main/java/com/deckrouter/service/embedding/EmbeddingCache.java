package com.deckrouter.service.embedding;

import com.deckrouter.model.EmbeddingEntry;
import com.deckrouter.model.dto.CacheStatistics;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Two-level embedding cache.
 *
 * Tool embeddings are keyed by tool name and carry the hash of the description they were
 * computed from; a changed description invalidates the entry on the next lookup. Query
 * embeddings are keyed by the hash of the expanded query text.
 *
 * The compute function runs outside any cache lock, so two threads missing on the same key
 * may both compute; the last write wins and both values are equivalent. A failed compute
 * leaves the cache untouched.
 */
@Slf4j
public class EmbeddingCache {

    private final Cache<String, EmbeddingEntry> toolCache;
    private final Cache<String, EmbeddingEntry> queryCache;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public EmbeddingCache(Cache<String, EmbeddingEntry> toolCache, Cache<String, EmbeddingEntry> queryCache) {
        this.toolCache = toolCache;
        this.queryCache = queryCache;
    }

    public static String contentHash(String text) {
        return DigestUtils.sha256Hex(text == null ? "" : text);
    }

    /**
     * Returns the cached embedding for a tool, or computes it from the description.
     *
     * @param toolName    cache key
     * @param description text the embedding is computed from
     * @param compute     provider call; exceptions propagate and nothing is stored
     */
    public EmbeddingEntry getOrComputeTool(String toolName, String description, Function<String, float[]> compute) {
        String hash = contentHash(description);
        EmbeddingEntry existing = toolCache.getIfPresent(toolName);
        if (existing != null && existing.matches(hash)) {
            hits.incrementAndGet();
            return existing;
        }

        misses.incrementAndGet();
        if (existing != null) {
            log.debug("Description changed for tool {}, recomputing embedding", toolName);
        }

        EmbeddingEntry entry = new EmbeddingEntry(hash, compute.apply(description));
        toolCache.put(toolName, entry);
        return entry;
    }

    /**
     * Returns the cached embedding for an (already expanded) query, or computes it.
     */
    public EmbeddingEntry getOrComputeQuery(String expandedQuery, Function<String, float[]> compute) {
        String hash = contentHash(expandedQuery);
        EmbeddingEntry cached = queryCache.getIfPresent(hash);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }

        misses.incrementAndGet();
        EmbeddingEntry entry = new EmbeddingEntry(hash, compute.apply(expandedQuery));
        queryCache.put(hash, entry);
        return entry;
    }

    /**
     * Cached tool entry if it is still valid for {@code description}. Counts a hit when
     * found; a miss is only counted once the caller computes.
     */
    public Optional<EmbeddingEntry> findTool(String toolName, String description) {
        EmbeddingEntry entry = toolCache.getIfPresent(toolName);
        if (entry != null && entry.matches(contentHash(description))) {
            hits.incrementAndGet();
            return Optional.of(entry);
        }
        return Optional.empty();
    }

    public void invalidateAll() {
        toolCache.invalidateAll();
        queryCache.invalidateAll();
        log.info("Embedding caches cleared");
    }

    public CacheStatistics stats() {
        toolCache.cleanUp();
        queryCache.cleanUp();
        long h = hits.get();
        long m = misses.get();
        return CacheStatistics.builder()
                .toolEntries(toolCache.estimatedSize())
                .queryEntries(queryCache.estimatedSize())
                .hits(h)
                .misses(m)
                .hitRate(h + m == 0 ? 0.0 : (double) h / (h + m))
                .build();
    }
}
