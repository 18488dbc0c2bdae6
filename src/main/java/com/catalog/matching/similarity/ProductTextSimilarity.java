package com.catalog.matching.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blended text similarity for product descriptions.
 * Formula: 0.5*levenshtein + 0.3*wordOverlap + 0.2*substring. Inputs are expected normalized.
 */
public class ProductTextSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(ProductTextSimilarity.class);

    static final double LEVENSHTEIN_WEIGHT = 0.5;
    static final double WORD_OVERLAP_WEIGHT = 0.3;
    static final double SUBSTRING_WEIGHT = 0.2;

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final WordOverlapSimilarity wordOverlap = new WordOverlapSimilarity();
    private final SubstringSimilarity substring = new SubstringSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        double lev = levenshtein.compute(s1, s2);
        double words = wordOverlap.compute(s1, s2);
        double sub = substring.compute(s1, s2);
        double score = LEVENSHTEIN_WEIGHT * lev + WORD_OVERLAP_WEIGHT * words + SUBSTRING_WEIGHT * sub;

        if (log.isTraceEnabled()) {
            log.trace("Product text similarity '{}' vs '{}': levenshtein={}, words={}, substring={}, score={}",
                    s1, s2, lev, words, sub, score);
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    @Override
    public String getName() {
        return "ProductText";
    }
}
