package com.deckrouter.service.routing;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.model.DisambiguationOption;
import com.deckrouter.model.EmbeddingEntry;
import com.deckrouter.model.RankedCandidate;
import com.deckrouter.model.RoutingDecision;
import com.deckrouter.service.embedding.EmbeddingCache;
import com.deckrouter.service.embedding.EmbeddingProviderException;
import com.deckrouter.service.embedding.EmbeddingService;
import com.deckrouter.tool.RoutableTool;
import com.deckrouter.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Routes a natural-language query to one tool.
 *
 * Flow:
 * 1. Follow-up queries naming a known tool execute it directly
 * 2. Expand the query and embed it (cached)
 * 3. Optionally drop tools whose capability check rejects the query
 * 4. Embed every remaining tool (cached, misses fetched concurrently)
 * 5. Rank by cosine similarity and apply the policy: execute, disambiguate or no match
 */
@Slf4j
@Service
public class SemanticToolRouter {

    private final QueryExpander queryExpander;
    private final EmbeddingCache cache;
    private final EmbeddingService embeddingService;
    private final ToolEmbeddingFetcher fetcher;
    private final SimilarityRanker ranker;
    private final ToolRegistry registry;
    private final RoutingPolicy defaultPolicy;

    @Autowired
    public SemanticToolRouter(
            QueryExpander queryExpander,
            EmbeddingCache cache,
            EmbeddingService embeddingService,
            ToolEmbeddingFetcher fetcher,
            SimilarityRanker ranker,
            ToolRegistry registry,
            DeckRouterProperties properties) {
        this(queryExpander, cache, embeddingService, fetcher, ranker, registry,
                RoutingPolicy.from(properties.getRouting(), registry.shortLabels()));
    }

    public SemanticToolRouter(
            QueryExpander queryExpander,
            EmbeddingCache cache,
            EmbeddingService embeddingService,
            ToolEmbeddingFetcher fetcher,
            SimilarityRanker ranker,
            ToolRegistry registry,
            RoutingPolicy defaultPolicy) {
        this.queryExpander = queryExpander;
        this.cache = cache;
        this.embeddingService = embeddingService;
        this.fetcher = fetcher;
        this.ranker = ranker;
        this.registry = registry;
        this.defaultPolicy = defaultPolicy;
        log.info("Initialized SemanticToolRouter: {}", defaultPolicy);
    }

    /**
     * Routes against the registered tools with the configured policy.
     */
    public RoutingDecision route(String query) {
        return route(query, registry.getTools(), defaultPolicy);
    }

    /**
     * Always returns exactly one decision. Only a failure to embed the query itself is an
     * error.
     *
     * @throws RoutingUnavailableException if the query embedding cannot be obtained
     */
    public RoutingDecision route(String query, List<? extends RoutableTool> tools, RoutingPolicy policy) {
        String effectiveQuery = query;

        Optional<FollowUpQuery> followUp = FollowUpQueryCodec.parse(query);
        if (followUp.isPresent()) {
            FollowUpQuery parsed = followUp.get();
            Optional<? extends RoutableTool> chosen = findByName(tools, parsed.getToolName());
            if (chosen.isPresent()) {
                log.info("Follow-up query selects tool {} directly", parsed.getToolName());
                return RoutingDecision.execute(parsed.getToolName(), 1.0);
            }
            log.warn("Follow-up query names unknown tool '{}', routing the original query", parsed.getToolName());
            effectiveQuery = parsed.getOriginalQuery();
        }

        if (effectiveQuery == null || effectiveQuery.isBlank() || tools.isEmpty()) {
            return RoutingDecision.noMatch();
        }

        List<RankedCandidate> ranking = rank(effectiveQuery, tools, policy);
        if (ranking.isEmpty()) {
            log.info("No tool could be ranked for query '{}'", effectiveQuery);
            return RoutingDecision.noMatch();
        }

        RankedCandidate best = ranking.get(0);
        if (best.getScore() >= policy.getExecuteThreshold()) {
            log.info("Routing to {} (score={})", best.getToolName(), String.format("%.3f", best.getScore()));
            return RoutingDecision.execute(best.getToolName(), best.getScore());
        }

        List<DisambiguationOption> options = new ArrayList<>();
        for (RankedCandidate candidate : ranking) {
            if (options.size() >= policy.getMaxOptions() || candidate.getScore() < policy.getRankThreshold()) {
                break;
            }
            options.add(DisambiguationOption.builder()
                    .label(policy.labelFor(candidate.getToolName()))
                    .toolName(candidate.getToolName())
                    .syntheticQuery(FollowUpQueryCodec.disambiguation(candidate.getToolName(), effectiveQuery))
                    .build());
        }

        if (options.isEmpty()) {
            log.info("Best tool {} scored {} below rank threshold {}, no match",
                    best.getToolName(), String.format("%.3f", best.getScore()), policy.getRankThreshold());
            return RoutingDecision.noMatch();
        }

        log.info("Ambiguous query, offering {} options: {}", options.size(),
                options.stream().map(DisambiguationOption::getToolName).collect(Collectors.toList()));
        return RoutingDecision.disambiguate(options);
    }

    /**
     * Best {@code n} registered tools scoring at or above the rank threshold.
     */
    public List<RankedCandidate> topTools(String query, int n) {
        if (query == null || query.isBlank() || n <= 0) {
            return List.of();
        }
        return rank(query, registry.getTools(), defaultPolicy).stream()
                .filter(candidate -> candidate.getScore() >= defaultPolicy.getRankThreshold())
                .limit(n)
                .collect(Collectors.toList());
    }

    /**
     * Loads every registered tool embedding into the cache.
     *
     * @return number of tools with a cached embedding afterwards
     */
    public int preload() {
        List<RoutableTool> tools = registry.getTools();
        int loaded = fetcher.fetch(tools).size();
        log.info("Preloaded {}/{} tool embeddings", loaded, tools.size());
        return loaded;
    }

    List<RankedCandidate> rank(String query, List<? extends RoutableTool> tools, RoutingPolicy policy) {
        String expanded = queryExpander.expand(query);

        EmbeddingEntry queryEntry;
        try {
            queryEntry = cache.getOrComputeQuery(expanded, embeddingService::embed);
        } catch (EmbeddingProviderException e) {
            log.error("Query embedding failed, routing unavailable: {}", e.getMessage());
            throw new RoutingUnavailableException("Query embedding unavailable: " + e.getMessage(), e);
        }

        List<? extends RoutableTool> candidates = policy.isCanHandleFilter() ? capableTools(query, tools) : tools;
        if (candidates.isEmpty()) {
            log.info("No tool accepted query '{}' in its capability check", query);
            return List.of();
        }

        Map<String, EmbeddingEntry> toolEntries = fetcher.fetch(candidates);

        List<RoutableTool> ranked = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        for (RoutableTool tool : candidates) {
            EmbeddingEntry entry = toolEntries.get(tool.getName());
            if (entry == null) {
                continue;
            }
            if (entry.dimensions() != queryEntry.dimensions()) {
                log.warn("Tool {} embedding has {} dimensions, query has {}; skipping",
                        tool.getName(), entry.dimensions(), queryEntry.dimensions());
                continue;
            }
            ranked.add(tool);
            vectors.add(entry.getNormalizedVector());
        }

        List<RankedCandidate> ranking = ranker.rank(queryEntry.getNormalizedVector(), vectors).stream()
                .map(scored -> new RankedCandidate(ranked.get(scored.getIndex()), scored.getScore()))
                .collect(Collectors.toList());

        if (log.isDebugEnabled()) {
            ranking.stream().limit(5).forEach(candidate ->
                    log.debug("  {} -> {}", candidate.getToolName(), String.format("%.4f", candidate.getScore())));
        }
        return ranking;
    }

    private List<RoutableTool> capableTools(String query, List<? extends RoutableTool> tools) {
        List<RoutableTool> capable = new ArrayList<>();
        for (RoutableTool tool : tools) {
            try {
                if (tool.canHandle(query)) {
                    capable.add(tool);
                }
            } catch (RuntimeException e) {
                log.warn("Capability check of {} failed, keeping it as a candidate: {}", tool.getName(), e.getMessage());
                capable.add(tool);
            }
        }
        return capable;
    }

    private static Optional<? extends RoutableTool> findByName(List<? extends RoutableTool> tools, String name) {
        return tools.stream().filter(tool -> tool.getName().equals(name)).findFirst();
    }

    public RoutingPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
