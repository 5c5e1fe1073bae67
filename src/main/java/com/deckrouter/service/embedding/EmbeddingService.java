package com.deckrouter.service.embedding;

/**
 * Service for generating text embeddings.
 * Implementations call a remote provider; callers cache the results.
 */
public interface EmbeddingService {

    /**
     * Generate embedding vector for text.
     *
     * @param text input text
     * @return embedding vector
     * @throws EmbeddingProviderException if the provider fails or times out
     */
    float[] embed(String text);

    /**
     * Get model name/identifier.
     *
     * @return model name
     */
    String modelName();

    /**
     * Check if service is configured and able to embed.
     *
     * @return true if ready to embed
     */
    boolean isReady();
}
