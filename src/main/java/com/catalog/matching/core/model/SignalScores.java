package com.catalog.matching.core.model;

/**
 * Per-signal similarity breakdown. Every component is in [0,1].
 */
public record SignalScores(
        double vector,
        double trigram,
        double fuzzy,
        double alias,
        double learned
) {
    public static final SignalScores ZERO = new SignalScores(0.0, 0.0, 0.0, 0.0, 0.0);

    public SignalScores {
        requireUnit("vector", vector);
        requireUnit("trigram", trigram);
        requireUnit("fuzzy", fuzzy);
        requireUnit("alias", alias);
        requireUnit("learned", learned);
    }

    /**
     * Same value for every signal. Training-tier matches report their similarity this way.
     */
    public static SignalScores uniform(double value) {
        return new SignalScores(value, value, value, value, value);
    }

    public double max() {
        return Math.max(Math.max(Math.max(vector, trigram), Math.max(fuzzy, alias)), learned);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " score must be between 0.0 and 1.0, got " + value);
        }
    }
}
