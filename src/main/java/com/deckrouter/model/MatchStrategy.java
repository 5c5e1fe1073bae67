package com.deckrouter.model;

/**
 * How an entity reference in a query was resolved to a deck code.
 */
public enum MatchStrategy {
    /** Explicit number in the query ("usina 97"). */
    NUMERIC_CODE,

    /** Whole query equals a deck name or a trusted alias. */
    EXACT_NAME,

    /** A deck name or alias appears as whole words inside the query. */
    NAME_IN_QUERY,

    /** Best edit-similarity above the threshold. */
    FUZZY_NAME,

    /** Shared significant tokens, last resort. */
    KEYWORD
}
