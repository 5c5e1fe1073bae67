package com.deckrouter.controller;

import com.deckrouter.model.RoutingDecision;
import com.deckrouter.model.dto.CandidateScore;
import com.deckrouter.model.dto.RouteRequest;
import com.deckrouter.service.routing.SemanticToolRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tool routing endpoints used by the orchestration layer.
 */
@Slf4j
@RestController
@RequestMapping("/v1/route")
public class RoutingController {

    private static final int DEFAULT_TOP_LIMIT = 3;

    private final SemanticToolRouter router;

    public RoutingController(SemanticToolRouter router) {
        this.router = router;
    }

    /**
     * Route a query to a tool.
     *
     * @return execute, disambiguate or none
     */
    @PostMapping
    public ResponseEntity<RoutingDecision> route(@RequestBody RouteRequest request) {
        if (request.getQuery() == null) {
            throw new IllegalArgumentException("query is required");
        }
        log.debug("Route request: {}", request.getQuery());
        return ResponseEntity.ok(router.route(request.getQuery()));
    }

    /**
     * Ranked candidates above the rank threshold, for diagnostics.
     */
    @PostMapping("/top")
    public ResponseEntity<List<CandidateScore>> top(@RequestBody RouteRequest request) {
        if (request.getQuery() == null) {
            throw new IllegalArgumentException("query is required");
        }
        int limit = request.getLimit() != null ? request.getLimit() : DEFAULT_TOP_LIMIT;
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        List<CandidateScore> candidates = router.topTools(request.getQuery(), limit).stream()
                .map(c -> new CandidateScore(c.getToolName(),
                        router.getDefaultPolicy().labelFor(c.getToolName()), c.getScore()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(candidates);
    }
}
