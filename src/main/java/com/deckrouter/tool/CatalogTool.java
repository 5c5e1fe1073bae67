package com.deckrouter.tool;

import com.deckrouter.service.text.TextNormalizer;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Tool declared in the JSON catalog. Its capability check looks for any of its keywords
 * in the query, ignoring case and accents; a tool without keywords accepts everything.
 */
@Getter
@ToString(of = "name")
public class CatalogTool implements RoutableTool {

    private final String name;
    private final String description;
    private final String shortLabel;
    private final List<String> keywords;

    @JsonCreator
    public CatalogTool(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("short_label") String shortLabel,
            @JsonProperty("keywords") List<String> keywords) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Catalog tool without a name");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Catalog tool '" + name + "' has no description");
        }
        this.name = name;
        this.description = description;
        this.shortLabel = shortLabel != null && !shortLabel.isBlank() ? shortLabel : name;
        this.keywords = keywords != null
                ? keywords.stream().map(TextNormalizer::fold).toList()
                : List.of();
    }

    @Override
    public boolean canHandle(String query) {
        if (keywords.isEmpty()) {
            return true;
        }
        if (query == null) {
            return false;
        }
        String folded = TextNormalizer.fold(query);
        return keywords.stream().anyMatch(folded::contains);
    }
}
