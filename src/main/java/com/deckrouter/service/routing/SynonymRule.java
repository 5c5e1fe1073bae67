package com.deckrouter.service.routing;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A query pattern and the phrases substituted for it, one expansion variant per phrase.
 */
@Getter
@ToString
public class SynonymRule {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private final Pattern pattern;
    private final List<String> replacements;

    public SynonymRule(String regex, List<String> replacements) {
        this.pattern = Pattern.compile(regex, FLAGS);
        this.replacements = List.copyOf(replacements);
    }
}
