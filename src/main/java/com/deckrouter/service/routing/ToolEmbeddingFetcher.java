package com.deckrouter.service.routing;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.model.EmbeddingEntry;
import com.deckrouter.service.embedding.EmbeddingCache;
import com.deckrouter.service.embedding.EmbeddingService;
import com.deckrouter.tool.RoutableTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Collects tool embeddings, computing cache misses concurrently on the embedding pool.
 *
 * Each miss is an independent task with its own timeout. A tool whose task fails or times
 * out is left out of the result; the others are unaffected. The returned map follows the
 * input order regardless of completion order.
 */
@Slf4j
@Service
public class ToolEmbeddingFetcher {

    private final EmbeddingCache cache;
    private final EmbeddingService embeddingService;
    private final Executor executor;
    private final Duration perItemTimeout;

    public ToolEmbeddingFetcher(
            EmbeddingCache cache,
            EmbeddingService embeddingService,
            @Qualifier("embeddingFetchExecutor") Executor executor,
            DeckRouterProperties properties) {
        this(cache, embeddingService, executor, properties.getRouting().getPerItemTimeout());
    }

    public ToolEmbeddingFetcher(EmbeddingCache cache, EmbeddingService embeddingService,
                                Executor executor, Duration perItemTimeout) {
        this.cache = cache;
        this.embeddingService = embeddingService;
        this.executor = executor;
        this.perItemTimeout = perItemTimeout;
    }

    /**
     * @return tool name to embedding, in input order, without the tools that failed
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public Map<String, EmbeddingEntry> fetch(List<? extends RoutableTool> tools) {
        Map<String, EmbeddingEntry> found = new HashMap<>();
        Map<String, CompletableFuture<EmbeddingEntry>> pending = new LinkedHashMap<>();

        for (RoutableTool tool : tools) {
            if (found.containsKey(tool.getName()) || pending.containsKey(tool.getName())) {
                continue;
            }
            cache.findTool(tool.getName(), tool.getDescription()).ifPresentOrElse(
                    entry -> found.put(tool.getName(), entry),
                    () -> submit(tool, pending));
        }

        if (!pending.isEmpty()) {
            log.debug("Fetching {} tool embeddings ({} cached)", pending.size(), found.size());
            awaitAll(pending);
            pending.forEach((name, future) -> collect(name, future, found));
        }

        Map<String, EmbeddingEntry> ordered = new LinkedHashMap<>();
        for (RoutableTool tool : tools) {
            EmbeddingEntry entry = found.get(tool.getName());
            if (entry != null) {
                ordered.put(tool.getName(), entry);
            }
        }
        return ordered;
    }

    private void submit(RoutableTool tool, Map<String, CompletableFuture<EmbeddingEntry>> pending) {
        try {
            CompletableFuture<EmbeddingEntry> future = CompletableFuture
                    .supplyAsync(() -> cache.getOrComputeTool(tool.getName(), tool.getDescription(), embeddingService::embed), executor)
                    .orTimeout(perItemTimeout.toMillis(), TimeUnit.MILLISECONDS);
            pending.put(tool.getName(), future);
        } catch (RejectedExecutionException e) {
            log.warn("Embedding pool rejected tool {}, skipping it: {}", tool.getName(), e.getMessage());
        }
    }

    private void awaitAll(Map<String, CompletableFuture<EmbeddingEntry>> pending) {
        CompletableFuture<Void> all = CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]));
        try {
            all.get();
        } catch (InterruptedException e) {
            pending.values().forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while fetching tool embeddings");
        } catch (ExecutionException e) {
            // individual failures are handled per tool in collect()
            log.trace("At least one tool embedding fetch failed", e);
        }
    }

    private void collect(String toolName, CompletableFuture<EmbeddingEntry> future, Map<String, EmbeddingEntry> found) {
        try {
            found.put(toolName, future.join());
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("Embedding for tool {} timed out after {} ms, dropping it from ranking",
                        toolName, perItemTimeout.toMillis());
            } else {
                log.warn("Embedding for tool {} failed, dropping it from ranking: {}", toolName, cause.getMessage());
            }
        }
    }
}
