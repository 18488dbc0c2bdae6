package com.catalog.matching.rest.dto;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchQuality;
import com.catalog.matching.core.model.SignalScores;
import com.catalog.matching.training.ApprovalRequest;

import java.util.Locale;

/**
 * Request DTO for recording a reviewer approval. Signal scores are those shown to the reviewer.
 */
public record ApprovalRequestDto(
        String lineItemText,
        String productId,
        String quality,
        Double confidence,
        Double finalScore,
        Double vectorScore,
        Double trigramScore,
        Double fuzzyScore,
        Double aliasScore,
        Double learnedScore,
        String approvedBy
) {
    public ApprovalRequestDto {
        if (lineItemText == null || lineItemText.isBlank()) {
            throw new IllegalArgumentException("lineItemText is required");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId is required");
        }
    }

    /**
     * @throws IllegalArgumentException if the quality is not a known grade or a score is out of range
     */
    public ApprovalRequest toRequest(CatalogScope scope) {
        MatchQuality grade = quality == null || quality.isBlank()
                ? MatchQuality.GOOD
                : MatchQuality.valueOf(quality.trim().toUpperCase(Locale.ROOT));
        SignalScores scores = new SignalScores(
                orZero(vectorScore), orZero(trigramScore), orZero(fuzzyScore), orZero(aliasScore), orZero(learnedScore));
        return new ApprovalRequest(
                scope,
                lineItemText,
                productId,
                scores,
                orZero(finalScore),
                grade,
                confidence != null ? confidence : ApprovalRequest.DEFAULT_CONFIDENCE,
                approvedBy);
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
