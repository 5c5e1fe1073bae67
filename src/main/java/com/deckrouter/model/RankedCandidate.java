package com.deckrouter.model;

import com.deckrouter.tool.RoutableTool;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A tool paired with its similarity to the query, in [0, 1].
 */
@Data
@AllArgsConstructor
public class RankedCandidate {
    private RoutableTool tool;
    private double score;

    public String getToolName() {
        return tool.getName();
    }
}
