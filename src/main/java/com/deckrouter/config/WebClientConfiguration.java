package com.deckrouter.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for calls to the embedding provider.
 */
@Configuration
public class WebClientConfiguration {

    // Embedding payloads (1536+ floats as JSON) exceed the 256KB codec default
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    private final DeckRouterProperties properties;

    public WebClientConfiguration(DeckRouterProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient embeddingWebClient() {
        long timeoutMs = properties.getEmbeddings().getTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMs, Integer.MAX_VALUE))
                .responseTimeout(properties.getEmbeddings().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build())
                .build();
    }
}
