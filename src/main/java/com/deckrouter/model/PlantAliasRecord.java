package com.deckrouter.model;

import lombok.Data;

/**
 * One row of an alias table: the name an entity carries inside the deck files and the
 * curated full name users tend to type. The code is reference data only; authoritative
 * codes come from the live deck.
 */
@Data
public class PlantAliasRecord {
    private final int code;
    private final String datasetName;
    private final String fullName;
}
