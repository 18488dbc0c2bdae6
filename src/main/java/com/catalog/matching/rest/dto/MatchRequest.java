package com.catalog.matching.rest.dto;

/**
 * Request DTO for matching a single line item.
 */
public record MatchRequest(String text, Integer limit, Double threshold) {
    public MatchRequest {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
    }
}
