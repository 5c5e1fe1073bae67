package com.deckrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Deck Router - semantic tool routing and plant resolution for deck queries.
 */
@SpringBootApplication
public class DeckRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeckRouterApplication.class, args);
    }
}
