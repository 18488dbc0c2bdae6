package com.catalog.matching.cache;

import com.catalog.matching.core.model.CatalogScope;

/**
 * Identity of a cached match result. The snapshot version changes whenever the scope's
 * catalog, aliases or training data change, so stale entries are never read.
 */
public record MatchCacheKey(
        CatalogScope scope,
        String normalizedQuery,
        int limit,
        double threshold,
        long snapshotVersion
) {
}
