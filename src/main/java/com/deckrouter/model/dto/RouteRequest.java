package com.deckrouter.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /v1/route} and {@code POST /v1/route/top}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {

    private String query;

    /**
     * Number of candidates for {@code /v1/route/top}; ignored by {@code /v1/route}.
     */
    private Integer limit;

    public RouteRequest(String query) {
        this.query = query;
    }
}
