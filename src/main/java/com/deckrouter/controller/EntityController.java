package com.deckrouter.controller;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.model.EntityKind;
import com.deckrouter.model.ResolutionResult;
import com.deckrouter.model.dto.ResolveRequest;
import com.deckrouter.service.matching.AliasExpandingEntityMatcher;
import com.deckrouter.service.matching.AliasTableLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Entity (plant / thermal class) resolution against decks supplied by the caller.
 */
@Slf4j
@RestController
@RequestMapping("/v1/entities")
public class EntityController {

    private final AliasExpandingEntityMatcher matcher;
    private final AliasTableLoader aliasTableLoader;
    private final DeckRouterProperties properties;

    public EntityController(AliasExpandingEntityMatcher matcher, AliasTableLoader aliasTableLoader,
                            DeckRouterProperties properties) {
        this.matcher = matcher;
        this.aliasTableLoader = aliasTableLoader;
        this.properties = properties;
    }

    /**
     * Resolve the entity a query refers to in one deck.
     *
     * @return the resolution, or {@code {"resolved": false}}
     */
    @PostMapping("/resolve")
    public ResponseEntity<?> resolve(@RequestBody ResolveRequest request) {
        if (request.getQuery() == null || request.getEntities() == null) {
            throw new IllegalArgumentException("query and entities are required");
        }
        EntityKind kind = EntityKind.fromName(request.getKind());
        Optional<ResolutionResult> result = matcher.resolve(
                request.getQuery(), request.getEntities(), aliasTableLoader.forKind(kind), kind, threshold(request));

        if (result.isEmpty()) {
            return ResponseEntity.ok(Map.of("resolved", false));
        }
        return ResponseEntity.ok(result.get());
    }

    /**
     * Resolve the same query in several decks at once.
     *
     * @return deck id to resolution, only for decks where something resolved
     */
    @PostMapping("/resolve-batch")
    public ResponseEntity<Map<String, ResolutionResult>> resolveBatch(@RequestBody ResolveRequest request) {
        if (request.getQuery() == null || request.getDecks() == null) {
            throw new IllegalArgumentException("query and decks are required");
        }
        EntityKind kind = EntityKind.fromName(request.getKind());
        return ResponseEntity.ok(matcher.resolveAcrossSnapshots(
                request.getQuery(), request.getDecks(), kind, threshold(request)));
    }

    private double threshold(ResolveRequest request) {
        double threshold = request.getThreshold() != null
                ? request.getThreshold()
                : properties.getMatching().getThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0,1]: " + threshold);
        }
        return threshold;
    }
}
