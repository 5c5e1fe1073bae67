package com.deckrouter.service.routing;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.service.text.TextNormalizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Rewrites a query into a "bag of phrasings" before it is embedded.
 *
 * Output is the original query followed by one variant per matching synonym replacement,
 * a punctuation-free variant and an accent-free variant, deduplicated case-insensitively
 * and joined by spaces. The output is deterministic for a given rule set, since it is the
 * basis of the query cache key.
 */
@Slf4j
@Service
public class QueryExpander {

    private final List<SynonymRule> rules;
    private final boolean enabled;

    @Autowired
    public QueryExpander(ResourceLoader resourceLoader, ObjectMapper objectMapper, DeckRouterProperties properties) {
        DeckRouterProperties.RoutingConfig routing = properties.getRouting();
        this.rules = loadRules(resourceLoader, objectMapper, routing.getExpansionsLocation());
        this.enabled = routing.isQueryExpansionEnabled();
        log.info("Query expansion {} with {} synonym rules", enabled ? "enabled" : "disabled", rules.size());
    }

    public QueryExpander(List<SynonymRule> rules, boolean enabled) {
        this.rules = List.copyOf(rules);
        this.enabled = enabled;
    }

    public String expand(String query) {
        if (!enabled) {
            return query;
        }
        return expand(query, rules);
    }

    public static String expand(String query, List<SynonymRule> rules) {
        if (query == null) {
            return "";
        }
        String lower = query.toLowerCase(Locale.ROOT);

        List<String> variants = new ArrayList<>();
        variants.add(query);

        for (SynonymRule rule : rules) {
            Matcher matcher = rule.getPattern().matcher(lower);
            if (!matcher.find()) {
                continue;
            }
            for (String replacement : rule.getReplacements()) {
                String rewritten = matcher.replaceAll(Matcher.quoteReplacement(replacement));
                if (!rewritten.equals(lower)) {
                    variants.add(rewritten);
                }
            }
        }

        String noPunct = TextNormalizer.stripPunctuation(query);
        if (!noPunct.equals(query)) {
            variants.add(noPunct);
        }
        String noAccents = TextNormalizer.stripDiacritics(lower);
        if (!noAccents.equals(lower)) {
            variants.add(noAccents);
        }

        Set<String> seen = new LinkedHashSet<>();
        List<String> unique = new ArrayList<>();
        for (String variant : variants) {
            String key = variant.toLowerCase(Locale.ROOT).trim();
            if (!key.isEmpty() && seen.add(key)) {
                unique.add(variant);
            }
        }
        String expanded = String.join(" ", unique);
        log.debug("Expanded query '{}' into {} variants", query, unique.size());
        return expanded;
    }

    public List<SynonymRule> getRules() {
        return rules;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Rules file: a JSON object of regex to replacement list, applied in file order.
     */
    static List<SynonymRule> loadRules(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        if (location == null || location.isBlank()) {
            return List.of();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Query expansion rules not found at {}, expanding with punctuation/accent variants only", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            LinkedHashMap<String, List<String>> raw =
                    objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, List<String>>>() { });
            List<SynonymRule> loaded = new ArrayList<>(raw.size());
            for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
                loaded.add(new SynonymRule(entry.getKey(), entry.getValue()));
            }
            return List.copyOf(loaded);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read query expansion rules " + location, e);
        }
    }
}
