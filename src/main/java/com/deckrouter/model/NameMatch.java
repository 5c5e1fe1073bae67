package com.deckrouter.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Candidate name chosen by fuzzy resolution, with its score in [0, 1].
 */
@Data
@AllArgsConstructor
public class NameMatch {
    private String name;
    private double score;
}
