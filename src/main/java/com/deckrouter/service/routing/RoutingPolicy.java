package com.deckrouter.service.routing;

import com.deckrouter.config.DeckRouterProperties;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Decision thresholds for one routing call.
 */
@Getter
@ToString(exclude = "labels")
public class RoutingPolicy {

    /** Minimum score to auto-run the best tool (inclusive). */
    private final double executeThreshold;
    /** Minimum score for a tool to be offered as a disambiguation option (inclusive). */
    private final double rankThreshold;
    private final int maxOptions;
    /** Drop tools whose {@code canHandle} rejects the query before ranking. */
    private final boolean canHandleFilter;
    /** Tool name to display label; tools missing here are labelled by name. */
    private final Map<String, String> labels;

    public RoutingPolicy(double executeThreshold, double rankThreshold, int maxOptions,
                         boolean canHandleFilter, Map<String, String> labels) {
        if (executeThreshold < 0.0 || executeThreshold > 1.0) {
            throw new IllegalArgumentException("executeThreshold must be in [0,1]: " + executeThreshold);
        }
        if (rankThreshold < 0.0 || rankThreshold > 1.0) {
            throw new IllegalArgumentException("rankThreshold must be in [0,1]: " + rankThreshold);
        }
        if (rankThreshold > executeThreshold) {
            throw new IllegalArgumentException(
                    "rankThreshold (" + rankThreshold + ") must not exceed executeThreshold (" + executeThreshold + ")");
        }
        if (maxOptions < 1) {
            throw new IllegalArgumentException("maxOptions must be at least 1: " + maxOptions);
        }
        this.executeThreshold = executeThreshold;
        this.rankThreshold = rankThreshold;
        this.maxOptions = maxOptions;
        this.canHandleFilter = canHandleFilter;
        this.labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public static RoutingPolicy from(DeckRouterProperties.RoutingConfig config, Map<String, String> labels) {
        return new RoutingPolicy(
                config.getExecuteThreshold(),
                config.getRankThreshold(),
                config.getMaxOptions(),
                config.isCanHandleFilter(),
                labels);
    }

    public RoutingPolicy withCanHandleFilter(boolean enabled) {
        return new RoutingPolicy(executeThreshold, rankThreshold, maxOptions, enabled, labels);
    }

    public String labelFor(String toolName) {
        return labels.getOrDefault(toolName, toolName);
    }
}
