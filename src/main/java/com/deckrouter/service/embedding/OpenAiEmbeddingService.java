package com.deckrouter.service.embedding;

import com.deckrouter.config.DeckRouterProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Embedding service backed by an OpenAI-compatible {@code /embeddings} endpoint.
 */
@Slf4j
@Service
public class OpenAiEmbeddingService implements EmbeddingService {

    private final WebClient webClient;
    private final DeckRouterProperties.EmbeddingsConfig config;

    public OpenAiEmbeddingService(WebClient embeddingWebClient, DeckRouterProperties properties) {
        this.webClient = embeddingWebClient;
        this.config = properties.getEmbeddings();
    }

    @Override
    public float[] embed(String text) {
        if (!isReady()) {
            throw new EmbeddingProviderException("Embedding provider is not configured (missing API key)");
        }

        String endpoint = config.getBaseUrl() + "/embeddings";

        Mono<JsonNode> responseMono = webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(Map.of("model", config.getModel(), "input", text))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout());

        JsonNode response;
        try {
            response = executeWithRetry(responseMono).block();
        } catch (EmbeddingProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new EmbeddingProviderException("Embedding request failed: " + describe(cause), cause);
        }
        return parseEmbedding(response);
    }

    @Override
    public String modelName() {
        return config.getModel();
    }

    @Override
    public boolean isReady() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    private Mono<JsonNode> executeWithRetry(Mono<JsonNode> request) {
        return request
                .retryWhen(Retry.backoff(config.getMaxRetries(), config.getRetryBackoff())
                        .maxBackoff(Duration.ofSeconds(10))
                        .filter(this::isRetryable)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnError(error -> log.warn("Embedding request to {} failed: {}", config.getBaseUrl(), describe(error)));
    }

    /**
     * Timeouts, connection failures and 5xx responses are retried; 4xx are not.
     */
    boolean isRetryable(Throwable throwable) {
        if (throwable instanceof TimeoutException || throwable instanceof WebClientRequestException) {
            return true;
        }
        if (throwable instanceof WebClientResponseException) {
            return ((WebClientResponseException) throwable).getStatusCode().is5xxServerError();
        }
        return false;
    }

    private float[] parseEmbedding(JsonNode response) {
        JsonNode embedding = response == null ? null : response.path("data").path(0).path("embedding");
        if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
            throw new EmbeddingProviderException("Embedding response has no vector");
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = embedding.get(i);
            if (!value.isNumber()) {
                throw new EmbeddingProviderException("Embedding response contains a non-numeric value at index " + i);
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }

    private static String describe(Throwable error) {
        if (error instanceof WebClientResponseException) {
            return "HTTP " + ((WebClientResponseException) error).getStatusCode().value();
        }
        if (error instanceof TimeoutException) {
            return "timeout";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
