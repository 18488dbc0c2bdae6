package com.catalog.matching.similarity;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared words divided by the word count of the longer text.
 */
public class WordOverlapSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> words1 = words(s1);
        Set<String> words2 = words(s2);
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }

        long common = words1.stream().filter(words2::contains).count();
        return (double) common / Math.max(words1.size(), words2.size());
    }

    @Override
    public String getName() {
        return "WordOverlap";
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.trim().split("\\s+"))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());
    }
}
