package com.catalog.matching.cache;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalScores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchCache Tests")
class MatchCacheTest {

    private static final CatalogScope ACME = CatalogScope.of("acme");
    private static final CatalogScope GLOBEX = CatalogScope.of("globex");

    private static List<MatchCandidate> candidates(String productId) {
        Product product = Product.of(productId, "SKU-" + productId, "hex bolt " + productId);
        return List.of(new MatchCandidate(product, SignalScores.uniform(0.5), 0.5,
                MatchSource.TRIGRAM, "trigram match", null));
    }

    private static MatchCacheKey key(CatalogScope scope, String query, long version) {
        return new MatchCacheKey(scope, query, 10, 0.3, version);
    }

    @Nested
    @DisplayName("CaffeineMatchCache")
    class CaffeineTests {

        private CaffeineMatchCache cache;

        @BeforeEach
        void setUp() {
            cache = new CaffeineMatchCache(new CacheConfig(100, 60, true));
        }

        @Test
        @DisplayName("Should return cached candidates for an identical key")
        void putAndGet() {
            cache.put(key(ACME, "hex bolt", 1), candidates("p1"));

            Optional<List<MatchCandidate>> cached = cache.get(key(ACME, "hex bolt", 1));
            assertTrue(cached.isPresent());
            assertEquals("p1", cached.get().get(0).productId());
        }

        @Test
        @DisplayName("A different snapshot version misses")
        void versionMiss() {
            cache.put(key(ACME, "hex bolt", 1), candidates("p1"));

            assertTrue(cache.get(key(ACME, "hex bolt", 2)).isEmpty());
        }

        @Test
        @DisplayName("Limit and threshold are part of the key")
        void limitAndThresholdInKey() {
            cache.put(key(ACME, "hex bolt", 1), candidates("p1"));

            assertTrue(cache.get(new MatchCacheKey(ACME, "hex bolt", 5, 0.3, 1)).isEmpty());
            assertTrue(cache.get(new MatchCacheKey(ACME, "hex bolt", 10, 0.5, 1)).isEmpty());
        }

        @Test
        @DisplayName("Stored lists are defensive copies")
        void defensiveCopy() {
            List<MatchCandidate> mutable = new ArrayList<>(candidates("p1"));
            cache.put(key(ACME, "hex bolt", 1), mutable);
            mutable.clear();

            assertEquals(1, cache.get(key(ACME, "hex bolt", 1)).orElseThrow().size());
        }

        @Test
        @DisplayName("Invalidating a scope leaves other scopes intact")
        void invalidateScope() {
            cache.put(key(ACME, "hex bolt", 1), candidates("p1"));
            cache.put(key(ACME, "hex nut", 1), candidates("p2"));
            cache.put(key(GLOBEX, "hex bolt", 1), candidates("p3"));

            cache.invalidate(ACME);

            assertTrue(cache.get(key(ACME, "hex bolt", 1)).isEmpty());
            assertTrue(cache.get(key(ACME, "hex nut", 1)).isEmpty());
            assertTrue(cache.get(key(GLOBEX, "hex bolt", 1)).isPresent());
        }

        @Test
        @DisplayName("invalidateAll drops everything")
        void invalidateAll() {
            cache.put(key(ACME, "hex bolt", 1), candidates("p1"));
            cache.put(key(GLOBEX, "hex bolt", 1), candidates("p3"));

            cache.invalidateAll();

            assertTrue(cache.get(key(ACME, "hex bolt", 1)).isEmpty());
            assertTrue(cache.get(key(GLOBEX, "hex bolt", 1)).isEmpty());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void stats() {
            cache.put(key(ACME, "hex bolt", 1), candidates("p1"));
            cache.get(key(ACME, "hex bolt", 1));
            cache.get(key(ACME, "hex bolt", 1));
            cache.get(key(ACME, "washer", 1));

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }
    }

    @Nested
    @DisplayName("NoOpMatchCache")
    class NoOpTests {

        @Test
        @DisplayName("Never returns anything")
        void neverCaches() {
            NoOpMatchCache cache = new NoOpMatchCache();
            cache.put(key(ACME, "hex bolt", 1), candidates("p1"));

            assertTrue(cache.get(key(ACME, "hex bolt", 1)).isEmpty());
            assertDoesNotThrow(() -> cache.invalidate(ACME));
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigTests {

        @Test
        void rejectsInvalidSizes() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }

        @Test
        void presets() {
            assertTrue(CacheConfig.defaults().enabled());
            assertFalse(CacheConfig.disabled().enabled());
            assertEquals(0.0, CacheStats.empty().hitRate());
        }
    }
}
