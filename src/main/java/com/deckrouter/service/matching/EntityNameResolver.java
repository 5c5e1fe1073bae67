package com.deckrouter.service.matching;

import com.deckrouter.model.NameMatch;
import com.deckrouter.service.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.LongestCommonSubsequence;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Fuzzy matcher for plant and asset names.
 *
 * Scoring, on normalized text:
 * - exact match: 1.0
 * - the shorter string occurs as whole words inside the longer: max(similarity, 0.7)
 * - otherwise the LCS similarity ratio
 *
 * The containment floor only applies on word boundaries, so "anta" gets no bonus inside
 * "santa clara".
 */
@Slf4j
@Service
public class EntityNameResolver {

    static final double CONTAINMENT_FLOOR = 0.7;

    private final LongestCommonSubsequence lcs;

    public EntityNameResolver() {
        this.lcs = new LongestCommonSubsequence();
    }

    /**
     * Best candidate scoring at least {@code threshold}. On equal scores the earliest
     * candidate wins.
     */
    public Optional<NameMatch> resolve(String query, Collection<String> candidates, double threshold) {
        String normalizedQuery = TextNormalizer.normalize(query);
        if (normalizedQuery.isEmpty() || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        String bestName = null;
        double bestScore = -1.0;
        for (String candidate : candidates) {
            String normalizedCandidate = TextNormalizer.normalize(candidate);
            if (normalizedCandidate.isEmpty()) {
                continue;
            }
            double score = score(normalizedQuery, normalizedCandidate);
            if (score > bestScore) {
                bestScore = score;
                bestName = candidate;
            }
            if (score >= 1.0) {
                break;
            }
        }

        if (bestName != null && bestScore >= threshold) {
            log.debug("Resolved '{}' to '{}' (score={})", query, bestName, String.format("%.3f", bestScore));
            return Optional.of(new NameMatch(bestName, bestScore));
        }
        log.debug("No name match for '{}' (best={}, threshold={})", query, bestScore, threshold);
        return Optional.empty();
    }

    /**
     * Score of two already-normalized strings, in [0,1].
     */
    public double score(String normalizedA, String normalizedB) {
        if (normalizedA.equals(normalizedB)) {
            return 1.0;
        }
        double ratio = ratio(normalizedA, normalizedB);
        String shorter = normalizedA.length() <= normalizedB.length() ? normalizedA : normalizedB;
        String longer = shorter == normalizedA ? normalizedB : normalizedA;
        if (!shorter.isEmpty() && TextNormalizer.containsWholeWords(longer, shorter)) {
            return Math.max(ratio, CONTAINMENT_FLOOR);
        }
        return ratio;
    }

    /**
     * 2 * LCS / (|a| + |b|).
     */
    public double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        int common = lcs.apply(a, b);
        return 2.0 * common / total;
    }
}
