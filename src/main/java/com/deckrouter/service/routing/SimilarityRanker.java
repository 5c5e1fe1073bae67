package com.deckrouter.service.routing;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cosine similarity of one query vector against a batch of candidate vectors.
 * All vectors must already be unit-normalized, so the dot product is the cosine.
 */
@Component
public class SimilarityRanker {

    /**
     * Scores every candidate and returns them best first. Scores are clipped to [0,1];
     * equal scores keep candidate input order.
     *
     * @throws IllegalArgumentException if a candidate's dimension differs from the query's
     */
    public List<ScoredIndex> rank(float[] queryNormalized, List<float[]> candidatesNormalized) {
        List<ScoredIndex> scored = new ArrayList<>(candidatesNormalized.size());
        for (int i = 0; i < candidatesNormalized.size(); i++) {
            float[] candidate = candidatesNormalized.get(i);
            if (candidate.length != queryNormalized.length) {
                throw new IllegalArgumentException("Candidate " + i + " has dimension " + candidate.length
                        + ", query has " + queryNormalized.length);
            }
            scored.add(new ScoredIndex(i, clip(dot(queryNormalized, candidate))));
        }
        // List.sort is stable
        scored.sort(Comparator.comparingDouble(ScoredIndex::getScore).reversed());
        return scored;
    }

    static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    static double clip(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Candidate position in the input list and its similarity score.
     */
    @Getter
    @AllArgsConstructor
    @ToString
    public static class ScoredIndex {
        private final int index;
        private final double score;
    }
}
