package com.catalog.matching.core.model;

import java.util.Objects;

/**
 * A ranked product candidate for a line item, with the signal breakdown that produced it.
 *
 * @param product           the matched catalog product
 * @param scores            per-signal scores
 * @param finalScore        combined confidence in [0,1]
 * @param matchedVia        the tier or dominant signal that produced the candidate
 * @param reasoning         human-readable explanation for reviewers
 * @param trainingExampleId id of the approved example behind a training-tier hit, otherwise null
 */
public record MatchCandidate(
        Product product,
        SignalScores scores,
        double finalScore,
        MatchSource matchedVia,
        String reasoning,
        String trainingExampleId
) {
    public MatchCandidate {
        Objects.requireNonNull(product, "product is required");
        Objects.requireNonNull(scores, "scores is required");
        Objects.requireNonNull(matchedVia, "matchedVia is required");
        if (Double.isNaN(finalScore) || finalScore < 0.0 || finalScore > 1.0) {
            throw new IllegalArgumentException("Final score must be between 0.0 and 1.0");
        }
    }

    public String productId() {
        return product.id();
    }

    public boolean isTrainingMatch() {
        return matchedVia.isTraining();
    }
}
