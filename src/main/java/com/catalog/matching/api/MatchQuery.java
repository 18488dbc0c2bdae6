package com.catalog.matching.api;

/**
 * A single match request. Limit and threshold are optional; {@link MatchOptions} clamps them.
 *
 * @param text      free-text line item
 * @param limit     requested number of results, or null for the default
 * @param threshold minimum final score for algorithmic results, or null for the default
 */
public record MatchQuery(String text, Integer limit, Double threshold) {

    public static MatchQuery of(String text) {
        return new MatchQuery(text, null, null);
    }

    public static MatchQuery of(String text, int limit, double threshold) {
        return new MatchQuery(text, limit, threshold);
    }

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
