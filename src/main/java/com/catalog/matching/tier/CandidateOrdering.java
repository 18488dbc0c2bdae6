package com.catalog.matching.tier;

import com.catalog.matching.core.model.MatchCandidate;

import java.util.Comparator;

/**
 * Deterministic result orderings.
 */
public final class CandidateOrdering {

    private CandidateOrdering() {
        // Utility class
    }

    /**
     * Final score descending, then product name, SKU and id ascending.
     */
    public static final Comparator<MatchCandidate> BY_SCORE =
            Comparator.comparingDouble(MatchCandidate::finalScore).reversed()
                    .thenComparing(c -> c.product().name())
                    .thenComparing(c -> c.product().sku(), Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(MatchCandidate::productId);
}
