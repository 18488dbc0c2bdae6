package com.catalog.matching.similarity;

/**
 * Containment score. A shorter text fully inside the longer one scores len(shorter)/len(longer);
 * otherwise the longest shared run of 3 to 10 characters is measured against the longer text.
 */
public class SubstringSimilarity implements SimilarityAlgorithm {

    private static final int MIN_RUN = 3;
    private static final int MAX_RUN = 10;

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        if (longer.contains(shorter)) {
            return (double) shorter.length() / longer.length();
        }

        int longest = 0;
        int maxRun = Math.min(MAX_RUN, shorter.length());
        for (int len = maxRun; len >= MIN_RUN && longest == 0; len--) {
            for (int i = 0; i + len <= shorter.length(); i++) {
                if (longer.contains(shorter.substring(i, i + len))) {
                    longest = len;
                    break;
                }
            }
        }
        return (double) longest / longer.length();
    }

    @Override
    public String getName() {
        return "Substring";
    }
}
