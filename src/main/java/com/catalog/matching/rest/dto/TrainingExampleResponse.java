package com.catalog.matching.rest.dto;

import com.catalog.matching.core.model.TrainingExample;

import java.time.Instant;

/**
 * REST response DTO for an approved training example.
 */
public record TrainingExampleResponse(
        String id,
        String lineItemText,
        String normalizedText,
        String productId,
        String productSku,
        String productName,
        String quality,
        double confidence,
        double weight,
        long referenceCount,
        String approvedBy,
        Instant approvedAt,
        Instant lastReferencedAt
) {
    public static TrainingExampleResponse from(TrainingExample example) {
        return new TrainingExampleResponse(
                example.getId(),
                example.getLineItemText(),
                example.getNormalizedText(),
                example.getProductId(),
                example.getProductSku(),
                example.getProductName(),
                example.getQuality().name(),
                example.getConfidence(),
                example.getWeight(),
                example.getReferenceCount(),
                example.getApprovedBy(),
                example.getApprovedAt(),
                example.getLastReferencedAt()
        );
    }
}
