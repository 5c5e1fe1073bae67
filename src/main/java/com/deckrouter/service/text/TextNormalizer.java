package com.deckrouter.service.text;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String helpers shared by query expansion and entity matching.
 *
 * "Whole word" here means the phrase is bounded by a non-word character or the end of the
 * text on both sides, so "anta" is not found inside "santa clara".
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_PUNCTUATION = Pattern.compile("[?!.,;:]");

    private TextNormalizer() {
    }

    /**
     * Lower-case and strip diacritics, keeping punctuation and spacing.
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        return stripDiacritics(text.toLowerCase(Locale.ROOT));
    }

    public static String stripDiacritics(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    /**
     * Canonical form for name comparison: folded, punctuation removed, whitespace collapsed.
     * "Usina  Angra-1 " becomes "usina angra1".
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String folded = fold(text);
        String noPunct = NON_WORD.matcher(folded).replaceAll("");
        return collapseWhitespace(noPunct);
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Removes sentence punctuation only ({@code ?!.,;:}), leaving accents and case alone.
     */
    public static String stripPunctuation(String text) {
        if (text == null) {
            return "";
        }
        return SENTENCE_PUNCTUATION.matcher(text).replaceAll("");
    }

    public static List<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(normalized));
    }

    public static boolean containsWholeWords(String text, String phrase) {
        if (text == null || phrase == null || phrase.isEmpty()) {
            return false;
        }
        return wholeWordPattern(phrase).matcher(text).find();
    }

    /**
     * Replaces every whole-word occurrence of {@code phrase} in {@code text}.
     */
    public static String replaceWholeWords(String text, String phrase, String replacement) {
        if (text == null || phrase == null || phrase.isEmpty()) {
            return text;
        }
        return wholeWordPattern(phrase).matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }

    private static Pattern wholeWordPattern(String phrase) {
        return Pattern.compile("(?<!\\w)" + Pattern.quote(phrase) + "(?!\\w)", Pattern.UNICODE_CHARACTER_CLASS);
    }
}
