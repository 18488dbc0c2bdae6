package com.catalog.matching.core.model;

/**
 * How a candidate was produced ("matched_via").
 */
public enum MatchSource {
    TRAINING_EXACT("training_exact", true),
    TRAINING_GOOD("training_good", true),
    LEARNED("learned", false),
    ALIAS("alias", false),
    VECTOR("vector", false),
    FUZZY("fuzzy", false),
    TRIGRAM("trigram", false),
    FALLBACK_FUZZY("fallback_fuzzy", false);

    private final String label;
    private final boolean training;

    MatchSource(String label, boolean training) {
        this.label = label;
        this.training = training;
    }

    public String label() {
        return label;
    }

    public boolean isTraining() {
        return training;
    }

    public boolean isAlgorithmic() {
        return !training && this != FALLBACK_FUZZY;
    }
}
