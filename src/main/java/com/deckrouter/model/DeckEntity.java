package com.deckrouter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * A (code, name) pair read from the deck currently being queried.
 */
@Data
public class DeckEntity {
    private final int code;
    private final String name;

    @JsonCreator
    public DeckEntity(@JsonProperty("code") int code, @JsonProperty("name") String name) {
        this.code = code;
        this.name = name;
    }
}
