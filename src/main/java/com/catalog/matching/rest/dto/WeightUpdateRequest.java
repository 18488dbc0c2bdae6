package com.catalog.matching.rest.dto;

/**
 * Request DTO for manually tuning a training example's weight.
 */
public record WeightUpdateRequest(Double weight, String updatedBy) {
    public WeightUpdateRequest {
        if (weight == null || weight.isNaN() || weight < 0.0) {
            throw new IllegalArgumentException("weight must be a number >= 0");
        }
    }
}
