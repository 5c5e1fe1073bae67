package com.deckrouter.service.routing;

import java.util.Optional;

/**
 * Builds and parses the synthetic queries sent back by the UI after a disambiguation or a
 * plant correction prompt.
 *
 * <pre>
 *   __DISAMBIG__:&lt;tool&gt;:&lt;original query&gt;
 *   __PLANT_CORR__:&lt;tool&gt;:&lt;code&gt;:&lt;original query&gt;
 * </pre>
 *
 * The original query is the last field, so it may itself contain colons.
 */
public final class FollowUpQueryCodec {

    static final String DISAMBIGUATION_PREFIX = "__DISAMBIG__:";
    static final String PLANT_CORRECTION_PREFIX = "__PLANT_CORR__:";

    private FollowUpQueryCodec() {
    }

    public static String disambiguation(String toolName, String originalQuery) {
        return DISAMBIGUATION_PREFIX + toolName + ":" + originalQuery;
    }

    public static String plantCorrection(String toolName, int code, String originalQuery) {
        return PLANT_CORRECTION_PREFIX + toolName + ":" + code + ":" + originalQuery;
    }

    public static boolean isFollowUp(String query) {
        return query != null
                && (query.startsWith(DISAMBIGUATION_PREFIX) || query.startsWith(PLANT_CORRECTION_PREFIX));
    }

    public static Optional<FollowUpQuery> parse(String query) {
        if (query == null) {
            return Optional.empty();
        }
        if (query.startsWith(DISAMBIGUATION_PREFIX)) {
            return parseDisambiguation(query.substring(DISAMBIGUATION_PREFIX.length()));
        }
        if (query.startsWith(PLANT_CORRECTION_PREFIX)) {
            return parsePlantCorrection(query.substring(PLANT_CORRECTION_PREFIX.length()));
        }
        return Optional.empty();
    }

    private static Optional<FollowUpQuery> parseDisambiguation(String body) {
        String[] parts = body.split(":", 2);
        if (parts.length != 2 || parts[0].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new FollowUpQuery(parts[0].trim(), parts[1].trim(), null));
    }

    private static Optional<FollowUpQuery> parsePlantCorrection(String body) {
        String[] parts = body.split(":", 3);
        if (parts.length != 3 || parts[0].isBlank()) {
            return Optional.empty();
        }
        try {
            int code = Integer.parseInt(parts[1].trim());
            return Optional.of(new FollowUpQuery(parts[0].trim(), parts[2].trim(), code));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
