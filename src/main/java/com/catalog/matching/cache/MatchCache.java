package com.catalog.matching.cache;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Cache of ranked candidates per normalized query.
 */
public interface MatchCache {

    Optional<List<MatchCandidate>> get(MatchCacheKey key);

    void put(MatchCacheKey key, List<MatchCandidate> candidates);

    /**
     * Drops every entry of the scope, e.g. after an approval.
     */
    void invalidate(CatalogScope scope);

    void invalidateAll();

    CacheStats getStats();
}
