package com.deckrouter.service.routing;

import com.deckrouter.config.DeckRouterProperties;
import com.deckrouter.service.embedding.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fills the tool embedding cache once the application is up, so the first routed query
 * does not pay for every tool embedding.
 */
@Slf4j
@Component
public class ToolEmbeddingWarmup {

    private final SemanticToolRouter router;
    private final EmbeddingService embeddingService;
    private final DeckRouterProperties properties;

    public ToolEmbeddingWarmup(SemanticToolRouter router, EmbeddingService embeddingService, DeckRouterProperties properties) {
        this.router = router;
        this.embeddingService = embeddingService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getRouting().isPreloadToolEmbeddings()) {
            log.debug("Tool embedding preload disabled");
            return;
        }
        if (!embeddingService.isReady()) {
            log.warn("Embedding provider not configured, skipping tool embedding preload");
            return;
        }
        router.preload();
    }
}
