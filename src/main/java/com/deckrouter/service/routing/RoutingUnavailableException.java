package com.deckrouter.service.routing;

/**
 * The query could not be routed because its embedding could not be obtained.
 * Distinct from a {@code NONE} decision, which means routing ran and nothing matched.
 */
public class RoutingUnavailableException extends RuntimeException {

    public RoutingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
