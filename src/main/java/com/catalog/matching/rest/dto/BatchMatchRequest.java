package com.catalog.matching.rest.dto;

import java.util.List;

/**
 * Request DTO for batch matching. Result {@code queryIndex} values refer to positions in {@code texts}.
 */
public record BatchMatchRequest(List<String> texts, Integer limit, Double threshold) {
    private static final int MAX_BATCH_SIZE = 1000;

    public BatchMatchRequest {
        if (texts == null || texts.isEmpty()) {
            throw new IllegalArgumentException("texts must not be empty");
        }
        if (texts.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                    "batch size " + texts.size() + " exceeds maximum of " + MAX_BATCH_SIZE);
        }
    }
}
