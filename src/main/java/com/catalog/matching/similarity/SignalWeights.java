package com.catalog.matching.similarity;

import com.catalog.matching.core.model.SignalScores;

/**
 * Weights for combining the per-signal scores of the algorithmic tier.
 * Non-negative and summing to 1.0, so the combined score stays in [0,1].
 */
public record SignalWeights(
        double trigram,
        double fuzzy,
        double alias,
        double learned,
        double vector
) {
    public SignalWeights {
        if (trigram < 0 || fuzzy < 0 || alias < 0 || learned < 0 || vector < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = trigram + fuzzy + alias + learned + vector;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: text overlap dominates, aliases next, learned and vector as tie-breakers.
     */
    public static SignalWeights defaultWeights() {
        return new SignalWeights(0.40, 0.25, 0.20, 0.10, 0.05);
    }

    /**
     * Weights for deployments with a populated embedding store.
     */
    public static SignalWeights vectorAssisted() {
        return new SignalWeights(0.30, 0.20, 0.15, 0.10, 0.25);
    }

    /**
     * Weights for tenants with a large body of approvals and aliases.
     */
    public static SignalWeights feedbackFocused() {
        return new SignalWeights(0.30, 0.15, 0.25, 0.25, 0.05);
    }

    public double combine(SignalScores scores) {
        double combined = trigram * scores.trigram()
                + fuzzy * scores.fuzzy()
                + alias * scores.alias()
                + learned * scores.learned()
                + vector * scores.vector();
        return Math.max(0.0, Math.min(1.0, combined));
    }

    @Override
    public String toString() {
        return String.format("SignalWeights{trigram=%.2f, fuzzy=%.2f, alias=%.2f, learned=%.2f, vector=%.2f}",
                trigram, fuzzy, alias, learned, vector);
    }
}
