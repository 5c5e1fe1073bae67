package com.deckrouter.model;

import lombok.Getter;

/**
 * Cached embedding for one piece of text.
 *
 * The entry is only valid for the text whose SHA-256 equals {@link #getContentHash()};
 * the normalized vector is computed once, at construction.
 */
@Getter
public class EmbeddingEntry {

    private final String contentHash;
    private final float[] vector;
    private final float[] normalizedVector;

    public EmbeddingEntry(String contentHash, float[] vector) {
        this.contentHash = contentHash;
        this.vector = vector.clone();
        this.normalizedVector = normalize(vector);
    }

    public int dimensions() {
        return vector.length;
    }

    public boolean matches(String hash) {
        return contentHash.equals(hash);
    }

    /**
     * L2 normalization. A zero vector is returned unchanged.
     */
    static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);

        float[] normalized = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = norm > 0 ? (float) (vector[i] / norm) : vector[i];
        }
        return normalized;
    }
}
