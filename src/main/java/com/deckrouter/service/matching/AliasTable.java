package com.deckrouter.service.matching;

import com.deckrouter.model.PlantAliasRecord;
import com.deckrouter.service.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Curated names for dataset-native entity names.
 *
 * Reference data only: the codes in the records are never returned to callers, the live
 * dataset is. When several records share a dataset-native name the longest curated name is
 * kept, the first one on equal length.
 */
public class AliasTable {

    private static final AliasTable EMPTY = new AliasTable(List.of());

    private final List<PlantAliasRecord> records;
    /** Folded dataset-native name to curated full name, longest native name first. */
    private final Map<String, String> fullNameByDatasetName;

    private AliasTable(List<PlantAliasRecord> records) {
        this.records = List.copyOf(records);

        Map<String, String> byName = new LinkedHashMap<>();
        for (PlantAliasRecord record : records) {
            String datasetName = TextNormalizer.collapseWhitespace(TextNormalizer.fold(record.getDatasetName()));
            String fullName = record.getFullName().trim();
            if (datasetName.isEmpty() || fullName.isEmpty()
                    || datasetName.equals(TextNormalizer.collapseWhitespace(TextNormalizer.fold(fullName)))) {
                continue;
            }
            String existing = byName.get(datasetName);
            if (existing == null || fullName.length() > existing.length()) {
                byName.put(datasetName, fullName);
            }
        }

        List<Map.Entry<String, String>> entries = new ArrayList<>(byName.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()));
        Map<String, String> ordered = new LinkedHashMap<>();
        entries.forEach(e -> ordered.put(e.getKey(), e.getValue()));
        this.fullNameByDatasetName = Collections.unmodifiableMap(ordered);
    }

    public static AliasTable of(List<PlantAliasRecord> records) {
        return records.isEmpty() ? EMPTY : new AliasTable(records);
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return fullNameByDatasetName.isEmpty();
    }

    public List<PlantAliasRecord> getRecords() {
        return records;
    }

    /**
     * Folded dataset-native name to curated full name, longest native name first.
     */
    public Map<String, String> aliases() {
        return fullNameByDatasetName;
    }

    public String fullNameFor(String datasetName) {
        return fullNameByDatasetName.get(TextNormalizer.collapseWhitespace(TextNormalizer.fold(datasetName)));
    }

    public int size() {
        return fullNameByDatasetName.size();
    }
}
