package com.deckrouter.tool;

/**
 * A handler that answers one category of deck question.
 * Implementations are registered once at startup and never change afterwards.
 */
public interface RoutableTool {

    /**
     * Unique tool name, also used as the tool embedding cache key.
     *
     * @return tool name
     */
    String getName();

    /**
     * Natural-language description; this is the text that gets embedded.
     *
     * @return tool description
     */
    String getDescription();

    /**
     * Cheap pre-check of whether this tool could attempt the query at all.
     * Only consulted when the routing policy enables the capability filter.
     *
     * @param query raw user query
     * @return true if the tool may handle the query
     */
    default boolean canHandle(String query) {
        return true;
    }
}
