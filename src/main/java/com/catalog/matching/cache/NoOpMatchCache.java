package com.catalog.matching.cache;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Cache that stores nothing.
 */
public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<List<MatchCandidate>> get(MatchCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(MatchCacheKey key, List<MatchCandidate> candidates) {
    }

    @Override
    public void invalidate(CatalogScope scope) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
