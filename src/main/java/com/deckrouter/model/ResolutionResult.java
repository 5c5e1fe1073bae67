package com.deckrouter.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolved entity code plus how it was found. Never cached: it belongs to one deck snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionResult {
    private int code;
    @JsonProperty("matched_name")
    private String matchedName;
    private MatchStrategy strategy;
    private double confidence;
}
