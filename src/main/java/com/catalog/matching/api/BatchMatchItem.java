package com.catalog.matching.api;

import com.catalog.matching.core.model.MatchCandidate;

import java.util.List;

/**
 * Result for one element of a batch.
 *
 * @param queryIndex 0-based position of the text in the submitted list
 * @param queryText  the submitted text
 * @param candidates ranked candidates; empty when nothing matched or the element failed
 */
public record BatchMatchItem(int queryIndex, String queryText, List<MatchCandidate> candidates) {

    public BatchMatchItem {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public boolean hasMatches() {
        return !candidates.isEmpty();
    }
}
