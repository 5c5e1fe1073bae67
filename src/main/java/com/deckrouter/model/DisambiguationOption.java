package com.deckrouter.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One choice offered to the user when routing is ambiguous.
 * Selecting it sends {@code syntheticQuery} back, which routes straight to {@code toolName}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisambiguationOption {

    private String label;

    @JsonProperty("tool_name")
    private String toolName;

    @JsonProperty("synthetic_query")
    private String syntheticQuery;
}
