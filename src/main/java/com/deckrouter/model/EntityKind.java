package com.deckrouter.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Kind of entity a query may reference. Each kind carries the patterns used to pull an
 * explicit numeric code out of a query and the extra words ignored by keyword matching.
 */
public enum EntityKind {

    PLANT(
            List.of(
                    "usina\\s*t[eé]rmica\\s*(\\d+)",
                    "usina\\s*hidrel[eé]trica\\s*(\\d+)",
                    "usina\\s*#?\\s*(\\d+)",
                    "c[oó]digo\\s*(\\d+)",
                    "t[eé]rmica\\s*(\\d+)",
                    "hidrel[eé]trica\\s*(\\d+)",
                    "ute\\s*(\\d+)",
                    "uhe\\s*(\\d+)"),
            Set.of("usina", "usinas", "térmica", "termica", "termelétrica", "termeletrica",
                    "termoelétrica", "termoeletrica", "hidrelétrica", "hidreletrica",
                    "cadastro", "características", "caracteristicas")),

    CLASS(
            List.of(
                    "classe\\s*t[eé]rmica\\s*(\\d+)",
                    "classe\\s*#?\\s*(\\d+)"),
            Set.of("classe", "classes", "térmica", "termica", "cadastro"));

    private static final Set<String> COMMON_STOP_WORDS = Set.of(
            "de", "da", "do", "das", "dos", "e", "a", "o", "as", "os",
            "em", "na", "no", "nas", "nos", "para", "por", "com", "sem",
            "à", "ao", "aos", "qual", "quais", "informacoes", "informações", "dados");

    private final List<Pattern> codePatterns;
    private final Set<String> stopWords;

    EntityKind(List<String> codePatterns, Set<String> extraStopWords) {
        this.codePatterns = codePatterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
        this.stopWords = extraStopWords;
    }

    /**
     * Ordered patterns whose first group captures a numeric code.
     */
    public List<Pattern> getCodePatterns() {
        return codePatterns;
    }

    public boolean isStopWord(String token) {
        return COMMON_STOP_WORDS.contains(token) || stopWords.contains(token);
    }

    /**
     * Lenient lookup used by the HTTP layer ("plant", "PLANT", "usina").
     */
    public static EntityKind fromName(String name) {
        if (name == null || name.isBlank()) {
            return PLANT;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "USINA":
                return PLANT;
            case "CLASSE":
                return CLASS;
            default:
                return EntityKind.valueOf(normalized);
        }
    }
}
