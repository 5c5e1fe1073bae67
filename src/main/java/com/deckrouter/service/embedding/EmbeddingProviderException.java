package com.deckrouter.service.embedding;

/**
 * Raised when the embedding provider cannot produce a vector.
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
