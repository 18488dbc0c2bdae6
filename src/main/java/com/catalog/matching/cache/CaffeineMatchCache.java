package com.catalog.matching.cache;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed match cache with a scope index for targeted invalidation.
 */
public class CaffeineMatchCache implements MatchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMatchCache.class);

    private final Cache<MatchCacheKey, List<MatchCandidate>> cache;
    // Secondary index: scope -> keys cached for that scope
    private final ConcurrentMap<CatalogScope, Set<MatchCacheKey>> scopeIndex = new ConcurrentHashMap<>();

    public CaffeineMatchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((MatchCacheKey key, List<MatchCandidate> value, RemovalCause cause) -> {
                    if (key != null) {
                        Set<MatchCacheKey> keys = scopeIndex.get(key.scope());
                        if (keys != null) {
                            keys.remove(key);
                        }
                    }
                })
                .build();
        log.info("CaffeineMatchCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<MatchCandidate>> get(MatchCacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(MatchCacheKey key, List<MatchCandidate> candidates) {
        cache.put(key, List.copyOf(candidates));
        scopeIndex.computeIfAbsent(key.scope(), s -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void invalidate(CatalogScope scope) {
        Set<MatchCacheKey> keys = scopeIndex.remove(scope);
        if (keys != null) {
            cache.invalidateAll(keys);
            log.debug("Invalidated {} cached matches for scope {}", keys.size(), scope);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        scopeIndex.clear();
        log.debug("Invalidated all cached matches");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
