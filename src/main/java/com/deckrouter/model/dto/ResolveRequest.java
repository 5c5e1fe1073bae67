package com.deckrouter.model.dto;

import com.deckrouter.model.DeckEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of the entity resolution endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveRequest {

    private String query;

    /**
     * Entity kind: {@code PLANT} (default) or {@code CLASS}.
     */
    private String kind;

    /**
     * Minimum fuzzy score; the configured default when absent.
     */
    private Double threshold;

    /**
     * Live (code, name) pairs of the deck being queried.
     */
    private List<DeckEntity> entities;

    /**
     * Deck id to live entities, for the multi-deck endpoint.
     */
    private Map<String, List<DeckEntity>> decks;
}
