package com.deckrouter.controller;

import com.deckrouter.service.routing.RoutingUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps service exceptions to JSON error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    /**
     * The embedding provider is down: the caller should retry later, not treat this as "no tool".
     */
    @ExceptionHandler(RoutingUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleRoutingUnavailable(RoutingUnavailableException ex) {
        log.error("Routing unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(error("routing_unavailable", ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
    }

    private static Map<String, String> error(String code, String message) {
        return Map.of("error", code, "message", message == null ? "" : message);
    }
}
