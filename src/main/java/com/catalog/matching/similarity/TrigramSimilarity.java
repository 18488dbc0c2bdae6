package com.catalog.matching.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Character-trigram overlap in the style of PostgreSQL's pg_trgm.
 * Each alphanumeric word is padded with two leading blanks and one trailing blank before
 * shingling; the score is |shared| / |union| over the two trigram sets.
 */
public class TrigramSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> t1 = trigrams(s1);
        Set<String> t2 = trigrams(s2);
        if (t1.isEmpty() || t2.isEmpty()) {
            return 0.0;
        }

        int shared = 0;
        for (String t : t1) {
            if (t2.contains(t)) {
                shared++;
            }
        }
        int union = t1.size() + t2.size() - shared;
        return (double) shared / union;
    }

    @Override
    public String getName() {
        return "Trigram";
    }

    /**
     * Trigram set of the given text. Non-alphanumeric characters separate words.
     */
    public static Set<String> trigrams(String text) {
        Set<String> result = new HashSet<>();
        if (text == null || text.isBlank()) {
            return result;
        }
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (word.isEmpty()) {
                continue;
            }
            String padded = "  " + word + " ";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                result.add(padded.substring(i, i + 3));
            }
        }
        return result;
    }
}
