package com.deckrouter.service.matching;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.model.EntityKind;
import com.deckrouter.model.PlantAliasRecord;
import com.deckrouter.service.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads alias tables from delimited files.
 *
 * Expected header columns (case and accents ignored):
 * - code: {@code codigo} or {@code code}
 * - dataset-native name: {@code nome_decomp}, {@code nome_arquivo} or {@code dataset_name}
 * - curated name: {@code nome_completo}, {@code nome completo}, {@code usina} or {@code full_name}
 *
 * Rows with a non-numeric code or a missing column are skipped. A missing or unreadable
 * file yields an empty table and one warning per location.
 */
@Slf4j
@Service
public class AliasTableLoader {

    private static final Set<String> CODE_COLUMNS = Set.of("codigo", "code");
    private static final Set<String> DATASET_NAME_COLUMNS = Set.of("nome_decomp", "nome_arquivo", "dataset_name");
    private static final Set<String> FULL_NAME_COLUMNS = Set.of("nome_completo", "nome completo", "usina", "full_name");

    private final ResourceLoader resourceLoader;
    private final Map<String, String> locationsByKind;
    private final char delimiter;

    private final Map<EntityKind, AliasTable> tablesByKind = new ConcurrentHashMap<>();
    private final Set<String> warnedLocations = ConcurrentHashMap.newKeySet();

    public AliasTableLoader(ResourceLoader resourceLoader, DeckRouterProperties properties) {
        this.resourceLoader = resourceLoader;
        this.locationsByKind = properties.getMatching().getAliasTables();
        this.delimiter = properties.getMatching().getAliasDelimiter();
    }

    /**
     * Configured alias table for an entity kind, loaded on first use.
     */
    public AliasTable forKind(EntityKind kind) {
        return tablesByKind.computeIfAbsent(kind, k -> {
            String location = locationsByKind.get(k.name());
            if (location == null) {
                location = locationsByKind.get(k.name().toLowerCase(Locale.ROOT));
            }
            if (location == null || location.isBlank()) {
                log.debug("No alias table configured for {}", k);
                return AliasTable.empty();
            }
            return load(location);
        });
    }

    public AliasTable load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            warnOnce(location, "Alias table not found at {}, matching without alias expansion");
            return AliasTable.empty();
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            AliasTable table = AliasTable.of(parse(reader, location));
            log.info("Loaded alias table {}: {} aliases from {} records", location, table.size(), table.getRecords().size());
            return table;
        } catch (IOException e) {
            log.warn("Failed to read alias table {}, matching without alias expansion", location, e);
            return AliasTable.empty();
        }
    }

    /**
     * Drops cached tables so the next lookup re-reads the files.
     */
    public void reload() {
        tablesByKind.clear();
        warnedLocations.clear();
    }

    List<PlantAliasRecord> parse(BufferedReader reader, String location) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine == null) {
            log.warn("Alias table {} is empty", location);
            return List.of();
        }
        if (!headerLine.isEmpty() && headerLine.charAt(0) == '\uFEFF') {
            headerLine = headerLine.substring(1);
        }

        List<String> header = splitLine(headerLine);
        int codeIndex = columnIndex(header, CODE_COLUMNS);
        int datasetIndex = columnIndex(header, DATASET_NAME_COLUMNS);
        int fullIndex = columnIndex(header, FULL_NAME_COLUMNS);
        if (codeIndex < 0 || datasetIndex < 0 || fullIndex < 0) {
            log.warn("Alias table {} lacks code/dataset-name/full-name columns (header: {}), ignoring it", location, header);
            return List.of();
        }
        int required = Math.max(codeIndex, Math.max(datasetIndex, fullIndex));

        List<PlantAliasRecord> records = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = splitLine(line);
            if (fields.size() <= required) {
                log.warn("Skipping alias row {}:{}: expected at least {} fields, got {}",
                        location, lineNumber, required + 1, fields.size());
                continue;
            }
            String datasetName = fields.get(datasetIndex).trim();
            String fullName = fields.get(fullIndex).trim();
            if (datasetName.isEmpty() || fullName.isEmpty()) {
                continue;
            }
            try {
                int code = Integer.parseInt(fields.get(codeIndex).trim());
                records.add(new PlantAliasRecord(code, datasetName, fullName));
            } catch (NumberFormatException e) {
                log.warn("Skipping alias row {}:{}: invalid code '{}'", location, lineNumber, fields.get(codeIndex));
            }
        }
        return records;
    }

    /**
     * Splits one delimited line. Double quotes group a field; a doubled quote inside a
     * quoted field is a literal quote.
     */
    List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == delimiter) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static int columnIndex(List<String> header, Set<String> names) {
        for (int i = 0; i < header.size(); i++) {
            String column = TextNormalizer.collapseWhitespace(TextNormalizer.fold(header.get(i)));
            if (names.contains(column)) {
                return i;
            }
        }
        return -1;
    }

    private void warnOnce(String location, String message) {
        if (warnedLocations.add(location)) {
            log.warn(message, location);
        }
    }
}
