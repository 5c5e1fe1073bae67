package com.deckrouter.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked tool in the {@code /v1/route/top} response.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateScore {

    @JsonProperty("tool_name")
    private String toolName;

    private String label;

    private double score;
}
