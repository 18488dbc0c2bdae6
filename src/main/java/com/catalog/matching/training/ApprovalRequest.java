package com.catalog.matching.training;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchQuality;
import com.catalog.matching.core.model.SignalScores;

import java.util.Objects;

/**
 * A reviewer's approval of a line item against a product.
 *
 * @param scores     signal scores observed when the match was proposed; null records zeros
 * @param finalScore final score observed when the match was proposed
 * @param quality    reviewer's grade; null means GOOD
 * @param confidence reviewer's confidence in [0, 1]
 */
public record ApprovalRequest(
        CatalogScope scope,
        String lineItemText,
        String productId,
        SignalScores scores,
        double finalScore,
        MatchQuality quality,
        double confidence,
        String approvedBy
) {
    public static final double DEFAULT_CONFIDENCE = 0.8;

    public ApprovalRequest {
        Objects.requireNonNull(scope, "scope is required");
        if (lineItemText == null || lineItemText.isBlank()) {
            throw new IllegalArgumentException("lineItemText is required");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId is required");
        }
        if (finalScore < 0.0 || finalScore > 1.0) {
            throw new IllegalArgumentException("finalScore must be between 0.0 and 1.0");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        scores = scores != null ? scores : SignalScores.ZERO;
        quality = quality != null ? quality : MatchQuality.GOOD;
    }

    public static ApprovalRequest of(CatalogScope scope, String lineItemText, String productId, MatchQuality quality) {
        return new ApprovalRequest(scope, lineItemText, productId, null, 0.0, quality, DEFAULT_CONFIDENCE, null);
    }
}
