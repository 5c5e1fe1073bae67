package com.deckrouter.service.matching;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.model.DeckEntity;
import com.deckrouter.model.EntityKind;
import com.deckrouter.model.MatchStrategy;
import com.deckrouter.model.NameMatch;
import com.deckrouter.model.ResolutionResult;
import com.deckrouter.service.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the plant (or thermal class) a query refers to, within one deck snapshot.
 *
 * Pipeline, first success wins:
 * 1. Explicit numeric code ("usina 97"), on the alias-expanded query then the raw query
 * 2. Alias expansion of dataset-native names into curated names
 * 3. Name resolution against live names plus curated aliases of live names:
 *    exact, longest whole name in the query, fuzzy; expanded query first, then raw
 * 4. Keyword overlap fallback
 *
 * Returned codes always belong to the live entities passed in. Alias table codes are never
 * used.
 */
@Slf4j
@Service
public class AliasExpandingEntityMatcher {

    static final int MIN_NAME_IN_QUERY_LENGTH = 4;
    static final int MIN_KEYWORD_LENGTH = 3;

    private final EntityNameResolver nameResolver;
    private final AliasTableLoader aliasTableLoader;
    private final Executor executor;
    private final Duration perItemTimeout;
    private final double defaultThreshold;

    @Autowired
    public AliasExpandingEntityMatcher(
            EntityNameResolver nameResolver,
            AliasTableLoader aliasTableLoader,
            @Qualifier("embeddingFetchExecutor") Executor executor,
            DeckRouterProperties properties) {
        this(nameResolver, aliasTableLoader, executor,
                properties.getRouting().getPerItemTimeout(), properties.getMatching().getThreshold());
    }

    public AliasExpandingEntityMatcher(EntityNameResolver nameResolver, AliasTableLoader aliasTableLoader,
                                       Executor executor, Duration perItemTimeout, double defaultThreshold) {
        this.nameResolver = nameResolver;
        this.aliasTableLoader = aliasTableLoader;
        this.executor = executor;
        this.perItemTimeout = perItemTimeout;
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * Resolves with the configured alias table for {@code kind} and the default threshold.
     */
    public Optional<ResolutionResult> resolve(String query, List<DeckEntity> live, EntityKind kind) {
        return resolve(query, live, aliasTableLoader.forKind(kind), kind, defaultThreshold);
    }

    public Optional<Integer> extractCode(String query, List<DeckEntity> live, AliasTable aliases,
                                         EntityKind kind, double threshold) {
        return resolve(query, live, aliases, kind, threshold).map(ResolutionResult::getCode);
    }

    public Optional<ResolutionResult> resolve(String query, List<DeckEntity> live, AliasTable aliases,
                                              EntityKind kind, double threshold) {
        if (query == null || query.isBlank() || live == null || live.isEmpty()) {
            return Optional.empty();
        }

        Map<Integer, DeckEntity> liveByCode = new LinkedHashMap<>();
        for (DeckEntity entity : live) {
            if (entity != null && entity.getName() != null && !entity.getName().isBlank()) {
                liveByCode.putIfAbsent(entity.getCode(), entity);
            }
        }
        if (liveByCode.isEmpty()) {
            return Optional.empty();
        }

        String raw = TextNormalizer.fold(query);
        String expanded = expandAliases(raw, aliases);
        List<String> variants = expanded.equals(raw) ? List.of(raw) : List.of(expanded, raw);

        for (String variant : variants) {
            Optional<ResolutionResult> numeric = extractNumeric(variant, liveByCode, kind);
            if (numeric.isPresent()) {
                return logged(query, numeric);
            }
        }

        List<PoolName> pool = buildPool(liveByCode, aliases);

        for (String variant : variants) {
            Optional<ResolutionResult> byName = resolveByName(variant, pool, threshold);
            if (byName.isPresent()) {
                return logged(query, byName);
            }
        }

        for (String variant : variants) {
            Optional<ResolutionResult> byKeyword = resolveByKeywords(variant, pool, kind);
            if (byKeyword.isPresent()) {
                return logged(query, byKeyword);
            }
        }

        log.info("No {} referenced in query '{}'", kind, query);
        return Optional.empty();
    }

    /**
     * Resolves the same query against several deck snapshots concurrently. A snapshot that
     * fails or times out is absent from the result, like one where nothing matched.
     *
     * @return deck id to result, in input order, for the decks where something resolved
     */
    public Map<String, ResolutionResult> resolveAcrossSnapshots(String query, Map<String, List<DeckEntity>> snapshots,
                                                                EntityKind kind, double threshold) {
        AliasTable aliases = aliasTableLoader.forKind(kind);
        Map<String, CompletableFuture<Optional<ResolutionResult>>> pending = new LinkedHashMap<>();
        for (Map.Entry<String, List<DeckEntity>> snapshot : snapshots.entrySet()) {
            try {
                pending.put(snapshot.getKey(), CompletableFuture
                        .supplyAsync(() -> resolve(query, snapshot.getValue(), aliases, kind, threshold), executor)
                        .orTimeout(perItemTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException e) {
                log.warn("Lookup for deck {} rejected by the pool, skipping it: {}", snapshot.getKey(), e.getMessage());
            }
        }

        try {
            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            pending.values().forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while resolving entities across decks");
        } catch (ExecutionException e) {
            // per-deck failures are reported below
            log.trace("At least one deck lookup failed", e);
        }

        Map<String, ResolutionResult> results = new LinkedHashMap<>();
        pending.forEach((deckId, future) -> {
            try {
                future.join().ifPresent(result -> results.put(deckId, result));
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof TimeoutException) {
                    log.warn("Entity lookup for deck {} timed out after {} ms", deckId, perItemTimeout.toMillis());
                } else {
                    log.warn("Entity lookup for deck {} failed: {}", deckId, cause.getMessage());
                }
            }
        });
        return results;
    }

    /**
     * Replaces whole-word occurrences of dataset-native names with their curated names,
     * longest native names first.
     */
    String expandAliases(String foldedQuery, AliasTable aliases) {
        if (aliases == null || aliases.isEmpty()) {
            return foldedQuery;
        }
        String expanded = foldedQuery;
        for (Map.Entry<String, String> alias : aliases.aliases().entrySet()) {
            if (!expanded.contains(alias.getKey())) {
                continue;
            }
            String replaced = TextNormalizer.replaceWholeWords(expanded, alias.getKey(), TextNormalizer.fold(alias.getValue()));
            if (!replaced.equals(expanded)) {
                log.debug("Expanded alias '{}' -> '{}'", alias.getKey(), alias.getValue());
                expanded = replaced;
            }
        }
        return expanded;
    }

    private Optional<ResolutionResult> extractNumeric(String query, Map<Integer, DeckEntity> liveByCode, EntityKind kind) {
        for (Pattern pattern : kind.getCodePatterns()) {
            Matcher matcher = pattern.matcher(query);
            while (matcher.find()) {
                int code;
                try {
                    code = Integer.parseInt(matcher.group(1));
                } catch (NumberFormatException e) {
                    continue;
                }
                DeckEntity entity = liveByCode.get(code);
                if (entity != null) {
                    return Optional.of(result(entity.getCode(), entity.getName(), MatchStrategy.NUMERIC_CODE, 1.0));
                }
                log.debug("Code {} in query is not present in this deck", code);
            }
        }
        return Optional.empty();
    }

    /**
     * Live names first, then curated names whose dataset-native name is live. Each pool
     * name carries the live code.
     */
    private List<PoolName> buildPool(Map<Integer, DeckEntity> liveByCode, AliasTable aliases) {
        List<PoolName> pool = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (DeckEntity entity : liveByCode.values()) {
            PoolName name = new PoolName(entity.getName(), entity.getCode());
            if (seen.add(name.normalized)) {
                pool.add(name);
            }
        }
        if (aliases == null || aliases.isEmpty()) {
            return pool;
        }
        for (DeckEntity entity : liveByCode.values()) {
            String fullName = aliases.fullNameFor(entity.getName());
            if (fullName == null) {
                continue;
            }
            PoolName alias = new PoolName(fullName, entity.getCode());
            if (seen.add(alias.normalized)) {
                pool.add(alias);
            }
        }
        return pool;
    }

    private Optional<ResolutionResult> resolveByName(String query, List<PoolName> pool, double threshold) {
        String normalizedQuery = TextNormalizer.normalize(query);
        if (normalizedQuery.isEmpty()) {
            return Optional.empty();
        }

        for (PoolName name : pool) {
            if (name.normalized.equals(normalizedQuery)) {
                return Optional.of(result(name.code, name.display, MatchStrategy.EXACT_NAME, 1.0));
            }
        }

        List<PoolName> byLength = new ArrayList<>(pool);
        byLength.sort(Comparator.comparingInt((PoolName name) -> name.normalized.length()).reversed());
        for (PoolName name : byLength) {
            if (name.normalized.length() >= MIN_NAME_IN_QUERY_LENGTH
                    && TextNormalizer.containsWholeWords(normalizedQuery, name.normalized)) {
                double confidence = nameResolver.score(normalizedQuery, name.normalized);
                return Optional.of(result(name.code, name.display, MatchStrategy.NAME_IN_QUERY, confidence));
            }
        }

        Map<String, PoolName> byDisplay = new LinkedHashMap<>();
        pool.forEach(name -> byDisplay.putIfAbsent(name.display, name));
        Optional<NameMatch> fuzzy = nameResolver.resolve(query, byDisplay.keySet(), threshold);
        if (fuzzy.isPresent()) {
            PoolName name = byDisplay.get(fuzzy.get().getName());
            return Optional.of(result(name.code, name.display, MatchStrategy.FUZZY_NAME, fuzzy.get().getScore()));
        }
        return Optional.empty();
    }

    /**
     * Scores each pool name by shared significant tokens, a bonus when every query token is
     * in the name, string similarity and name length. Any positive score qualifies; the
     * query needs at least one significant token.
     *
     * Confidence is the share of query tokens found in the name, or the string similarity
     * when no token is shared.
     */
    private Optional<ResolutionResult> resolveByKeywords(String query, List<PoolName> pool, EntityKind kind) {
        Set<String> queryTokens = significantTokens(query, kind);
        if (queryTokens.isEmpty()) {
            return Optional.empty();
        }
        String normalizedQuery = TextNormalizer.normalize(query);

        PoolName best = null;
        double bestScore = 0.0;
        int bestShared = 0;
        double bestRatio = 0.0;
        for (PoolName name : pool) {
            Set<String> nameTokens = significantTokens(name.display, kind);
            int shared = 0;
            for (String token : queryTokens) {
                if (nameTokens.contains(token)) {
                    shared++;
                }
            }
            double ratio = nameResolver.ratio(normalizedQuery, name.normalized);
            double score = shared;
            if (shared == queryTokens.size()) {
                score += 10;
            }
            score += ratio * 5;
            score += name.normalized.length() / 100.0;
            log.debug("  keyword score {} -> {}", name.display, String.format("%.3f", score));
            if (score > bestScore) {
                bestScore = score;
                best = name;
                bestShared = shared;
                bestRatio = ratio;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        double confidence = bestShared > 0 ? (double) bestShared / queryTokens.size() : bestRatio;
        return Optional.of(result(best.code, best.display, MatchStrategy.KEYWORD, confidence));
    }

    private static Set<String> significantTokens(String text, EntityKind kind) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : TextNormalizer.tokens(text)) {
            if (token.length() >= MIN_KEYWORD_LENGTH && !kind.isStopWord(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static ResolutionResult result(int code, String name, MatchStrategy strategy, double confidence) {
        return ResolutionResult.builder()
                .code(code)
                .matchedName(name)
                .strategy(strategy)
                .confidence(confidence)
                .build();
    }

    private static Optional<ResolutionResult> logged(String query, Optional<ResolutionResult> result) {
        result.ifPresent(r -> log.info("Resolved '{}' to code {} ('{}') via {} (confidence={})",
                query, r.getCode(), r.getMatchedName(), r.getStrategy(), String.format("%.2f", r.getConfidence())));
        return result;
    }

    private static final class PoolName {
        private final String display;
        private final String normalized;
        private final int code;

        private PoolName(String display, int code) {
            this.display = display;
            this.normalized = TextNormalizer.normalize(display);
            this.code = code;
        }
    }
}
