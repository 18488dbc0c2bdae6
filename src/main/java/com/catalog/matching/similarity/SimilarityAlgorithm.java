package com.catalog.matching.similarity;

/**
 * A string similarity measure returning a score in [0,1].
 */
public interface SimilarityAlgorithm {

    /**
     * Computes similarity between two strings. Null on either side scores 0.
     */
    double compute(String s1, String s2);

    String getName();
}
