package com.deckrouter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of routing one query: run a tool, ask the user to pick one, or nothing matched.
 *
 * Serialized as {@code {kind, tool?, score?, options?}} for the orchestration layer.
 */
@Getter
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutingDecision {

    private static final RoutingDecision NO_MATCH = new RoutingDecision(Kind.NONE, null, null, null);

    private final Kind kind;
    private final String tool;
    private final Double score;
    private final List<DisambiguationOption> options;

    public static RoutingDecision execute(String tool, double score) {
        return new RoutingDecision(Kind.EXECUTE, tool, score, null);
    }

    public static RoutingDecision disambiguate(List<DisambiguationOption> options) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("Disambiguation requires at least one option");
        }
        return new RoutingDecision(Kind.DISAMBIGUATE, null, null, List.copyOf(options));
    }

    public static RoutingDecision noMatch() {
        return NO_MATCH;
    }

    @JsonIgnore
    public boolean isExecute() {
        return kind == Kind.EXECUTE;
    }

    @JsonIgnore
    public boolean isDisambiguate() {
        return kind == Kind.DISAMBIGUATE;
    }

    @JsonIgnore
    public boolean isNoMatch() {
        return kind == Kind.NONE;
    }

    public enum Kind {
        EXECUTE("execute"),
        DISAMBIGUATE("disambiguate"),
        NONE("none");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }
    }
}
