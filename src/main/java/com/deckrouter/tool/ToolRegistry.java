package com.deckrouter.tool;

import com.deckrouter.config.DeckRouterProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routable tools known to the router, in registration order: {@link RoutableTool} beans
 * first, then the entries of the JSON tool catalog.
 */
@Slf4j
@Service
public class ToolRegistry {

    private final Map<String, RoutableTool> tools;

    @Autowired
    public ToolRegistry(
            ObjectProvider<RoutableTool> toolBeans,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            DeckRouterProperties properties) {
        List<RoutableTool> all = new ArrayList<>();
        toolBeans.orderedStream().forEach(all::add);
        all.addAll(loadCatalog(resourceLoader, objectMapper, properties.getRouting().getCatalogLocation()));
        this.tools = index(all);
        log.info("Initialized ToolRegistry with {} tools: {}", tools.size(), tools.keySet());
    }

    public ToolRegistry(List<? extends RoutableTool> tools) {
        this.tools = index(tools);
    }

    public List<RoutableTool> getTools() {
        return List.copyOf(tools.values());
    }

    public Optional<RoutableTool> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    /**
     * Display label per tool name: the catalog short label, or the name itself.
     */
    public Map<String, String> shortLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (RoutableTool tool : tools.values()) {
            if (tool instanceof CatalogTool) {
                labels.put(tool.getName(), ((CatalogTool) tool).getShortLabel());
            } else {
                labels.put(tool.getName(), tool.getName());
            }
        }
        return labels;
    }

    public int size() {
        return tools.size();
    }

    private static Map<String, RoutableTool> index(List<? extends RoutableTool> tools) {
        Map<String, RoutableTool> indexed = new LinkedHashMap<>();
        for (RoutableTool tool : tools) {
            RoutableTool previous = indexed.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                log.warn("Duplicate tool name '{}', keeping the first registration", tool.getName());
            }
        }
        return Collections.unmodifiableMap(indexed);
    }

    private static List<CatalogTool> loadCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        if (location == null || location.isBlank()) {
            return List.of();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Tool catalog not found at {}, no catalog tools registered", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<CatalogTool> catalog = objectMapper.readValue(in, new TypeReference<List<CatalogTool>>() { });
            log.debug("Loaded {} tools from {}", catalog.size(), location);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tool catalog " + location, e);
        }
    }
}
