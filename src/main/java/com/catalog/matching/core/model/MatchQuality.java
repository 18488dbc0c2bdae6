package com.catalog.matching.core.model;

import java.util.Locale;

/**
 * Reviewer's grading of an approved match.
 * Only {@link #EXCELLENT} and {@link #GOOD} examples are used for training lookups.
 */
public enum MatchQuality {
    EXCELLENT(1.2),
    GOOD(1.1),
    FAIR(1.0),
    POOR(1.0);

    private final double learnedMultiplier;

    MatchQuality(double learnedMultiplier) {
        this.learnedMultiplier = learnedMultiplier;
    }

    /**
     * Boost applied to an example's contribution in the learned-similarity signal.
     */
    public double learnedMultiplier() {
        return learnedMultiplier;
    }

    public boolean isTrainable() {
        return this == EXCELLENT || this == GOOD;
    }

    /**
     * Parses a quality label, falling back to the given default for blank or unknown values.
     */
    public static MatchQuality parse(String value, MatchQuality fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
