package com.catalog.matching.api;

import com.catalog.matching.cache.CacheConfig;
import com.catalog.matching.cache.CaffeineMatchCache;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchQuality;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.metrics.MicrometerMetricsService;
import com.catalog.matching.rules.DefaultNormalizationRules;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.similarity.TokenBlockingKeyStrategy;
import com.catalog.matching.store.CatalogStore;
import com.catalog.matching.store.CatalogUnavailableException;
import com.catalog.matching.store.InMemoryCatalogStore;
import com.catalog.matching.store.InMemoryTrainingDataStore;
import com.catalog.matching.training.ApprovalAck;
import com.catalog.matching.training.ApprovalRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end matching scenarios against an in-memory catalog:
 * 1. A verbatim approved line item is answered by the exact training tier
 * 2. Blank input yields nothing
 * 3. Unrelated text yields nothing, even after relaxation
 * 4. Ties are broken by name, then SKU
 * 5. An approval is visible to the next query
 */
@DisplayName("ProductMatcher Scenario Tests")
class ProductMatcherScenarioTest {

    private static final CatalogScope SCOPE = CatalogScope.of("acme");
    private static final Instant NOW = Instant.parse("2026-04-01T09:00:00Z");
    private static final String CAP_SCREW_TEXT = "gr. 8 hx hd cap scr 5/16-18x2-1/2";

    private NormalizationEngine engine;
    private InMemoryCatalogStore catalog;
    private InMemoryTrainingDataStore trainingStore;
    private SimpleMeterRegistry registry;
    private ProductMatcher matcher;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
        catalog = new InMemoryCatalogStore(engine, new TokenBlockingKeyStrategy());
        catalog.saveAll(SCOPE, List.of(
                new Product("p-56", "56X212C8", "Hex Cap Screw Grade 8 5/16-18 x 2-1/2", "Brighton", "Fasteners"),
                new Product("p-gog", "SG-100", "Safety Goggles Clear", "3M", "PPE"),
                new Product("p-a", "HB-900", "Hex Bolt Zinc", null, "Fasteners"),
                new Product("p-z", "HB-100", "Hex Bolt Zinc", null, "Fasteners"),
                new Product("p-nut", "HN-1", "Hex Nut Zinc", null, "Fasteners")));
        trainingStore = new InMemoryTrainingDataStore();
        registry = new SimpleMeterRegistry();
        matcher = ProductMatcher.builder()
                .catalogStore(catalog)
                .trainingStore(trainingStore)
                .normalizationEngine(engine)
                .cache(new CaffeineMatchCache(new CacheConfig(100, 60, true)))
                .metricsService(new MicrometerMetricsService(registry))
                .options(MatchOptions.builder().approvalRetryDelay(Duration.ZERO).build())
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    @AfterEach
    void tearDown() {
        matcher.close();
    }

    private static List<String> productIds(List<MatchCandidate> candidates) {
        return candidates.stream().map(MatchCandidate::productId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Scenario 1: Verbatim approved line item")
    class ExactTraining {

        @Test
        @DisplayName("Approved text is answered by the exact training tier with score 1.0")
        void approvedTextHitsExactTier() {
            trainingStore.save(TrainingExample.builder()
                    .scope(SCOPE)
                    .lineItemText(CAP_SCREW_TEXT)
                    .normalizedText(engine.normalize(CAP_SCREW_TEXT))
                    .productId("p-56")
                    .quality(MatchQuality.EXCELLENT)
                    .confidence(1.0)
                    .approvedAt(NOW.minus(Duration.ofDays(1)))
                    .build());

            List<MatchCandidate> results = matcher.match(SCOPE, CAP_SCREW_TEXT);

            assertFalse(results.isEmpty());
            MatchCandidate top = results.get(0);
            assertEquals("56X212C8", top.product().sku());
            assertEquals(1.0, top.finalScore());
            assertEquals(MatchSource.TRAINING_EXACT, top.matchedVia());
            assertEquals("training_exact", top.matchedVia().label());
            assertNotNull(top.trainingExampleId());
        }

        @Test
        @DisplayName("An approval older than a year still answers verbatim text")
        void oldApprovalHitsExactTier() {
            trainingStore.save(TrainingExample.builder()
                    .scope(SCOPE)
                    .lineItemText(CAP_SCREW_TEXT)
                    .normalizedText(engine.normalize(CAP_SCREW_TEXT))
                    .productId("p-56")
                    .quality(MatchQuality.EXCELLENT)
                    .confidence(1.0)
                    .approvedAt(NOW.minus(Duration.ofDays(400)))
                    .build());

            MatchCandidate top = matcher.match(SCOPE, CAP_SCREW_TEXT).get(0);

            assertEquals("56X212C8", top.product().sku());
            assertEquals(1.0, top.finalScore());
            assertEquals(MatchSource.TRAINING_EXACT, top.matchedVia());
        }
    }

    @Nested
    @DisplayName("Scenario 2: Blank input")
    class BlankInput {

        @Test
        @DisplayName("Empty, blank, null and symbol-only text return an empty list")
        void blankInputReturnsEmpty() {
            assertTrue(matcher.match(SCOPE, "").isEmpty());
            assertTrue(matcher.match(SCOPE, "   ").isEmpty());
            assertTrue(matcher.match(SCOPE, (String) null).isEmpty());
            assertTrue(matcher.match(SCOPE, "!!! ###").isEmpty());
        }
    }

    @Nested
    @DisplayName("Scenario 3: Unrelated text")
    class UnrelatedText {

        @Test
        @DisplayName("Text with no overlap returns an empty list after every tier")
        void noOverlapReturnsEmpty() {
            List<MatchCandidate> results = matcher.match(SCOPE, "qqqqqqqq xxxxxxxxxx wwwwwwww");

            assertTrue(results.isEmpty());
            assertEquals(1L, registry.get("catalog.match.duration").tag("tier", "none").timer().count());
        }
    }

    @Nested
    @DisplayName("Scenario 4: Deterministic tie-breaking")
    class TieBreaking {

        @Test
        @DisplayName("Equal names tie on score and are ordered by SKU, stably")
        void tiesOrderedByNameThenSku() {
            for (int run = 0; run < 3; run++) {
                List<MatchCandidate> results = matcher.match(SCOPE, "hex bolt zinc");

                assertEquals(List.of("p-z", "p-a"), productIds(results).subList(0, 2));
                assertEquals(results.get(0).finalScore(), results.get(1).finalScore());
                assertTrue(results.get(0).matchedVia().isAlgorithmic());
            }
        }
    }

    @Nested
    @DisplayName("Scenario 5: Feedback loop")
    class FeedbackLoop {

        @Test
        @DisplayName("An approval answers the same text from training on the next query")
        void approvalVisibleToNextQuery() {
            List<MatchCandidate> before = matcher.match(SCOPE, "SAFETY GOGGLES");
            assertFalse(before.isEmpty());
            assertFalse(before.get(0).isTrainingMatch());

            ApprovalAck ack = matcher.recordApproval(
                    ApprovalRequest.of(SCOPE, "SAFETY GOGGLES", "p-gog", MatchQuality.EXCELLENT));
            assertTrue(ack.persisted());

            List<MatchCandidate> after = matcher.match(SCOPE, "SAFETY GOGGLES");

            assertEquals("p-gog", after.get(0).productId());
            assertTrue(after.get(0).isTrainingMatch());
            assertEquals(1.0, after.get(0).finalScore());
            assertEquals(ack.exampleId(), after.get(0).trainingExampleId());
        }

        @Test
        @DisplayName("A FAIR approval also answers the same text from training")
        void fairApprovalVisibleToNextQuery() {
            ApprovalAck ack = matcher.recordApproval(
                    ApprovalRequest.of(SCOPE, "SAFETY GOGGLES", "p-gog", MatchQuality.FAIR));
            assertTrue(ack.persisted());

            MatchCandidate top = matcher.match(SCOPE, "SAFETY GOGGLES").get(0);

            assertEquals("p-gog", top.productId());
            assertEquals(MatchSource.TRAINING_EXACT, top.matchedVia());
            assertEquals(1.0, top.finalScore());
            assertEquals(ack.exampleId(), top.trainingExampleId());
        }

        @Test
        @DisplayName("Training hits bump the example's reference counter")
        void trainingHitsAreReferenced() {
            ApprovalAck ack = matcher.recordApproval(
                    ApprovalRequest.of(SCOPE, "safety goggles", "p-gog", MatchQuality.GOOD));

            matcher.match(SCOPE, "safety goggles");

            assertEquals(1, matcher.getTrainingExamples(SCOPE, "p-gog").get(0).getReferenceCount());
            assertEquals(ack.exampleId(), matcher.getTrainingExamples(SCOPE, "p-gog").get(0).getId());
        }

        @Test
        @DisplayName("Training weights can be updated through the matcher")
        void weightUpdateThroughMatcher() {
            ApprovalAck ack = matcher.recordApproval(
                    ApprovalRequest.of(SCOPE, "safety goggles", "p-gog", MatchQuality.GOOD));

            assertTrue(matcher.updateTrainingWeight(SCOPE, ack.exampleId(), 0.5, "admin").isPresent());
            assertEquals(0.5, matcher.getTrainingExamples(SCOPE, "p-gog").get(0).getWeight());
        }
    }

    @Nested
    @DisplayName("Result properties")
    class ResultProperties {

        @ParameterizedTest
        @ValueSource(strings = {"hex bolt", "safety goggles clear", "cap screw 5/16", "zinc", "hx bolt zp", "HB-100"})
        @DisplayName("Results respect limit, score range, tier purity and idempotence")
        void resultProperties(String text) {
            List<MatchCandidate> first = matcher.match(SCOPE, text, 2, null);
            List<MatchCandidate> second = matcher.match(SCOPE, text, 2, null);

            assertTrue(first.size() <= 2);
            assertEquals(first, second);
            for (MatchCandidate candidate : first) {
                assertTrue(candidate.finalScore() >= 0.0 && candidate.finalScore() <= 1.0);
                assertTrue(candidate.scores().max() <= 1.0);
                assertEquals(first.get(0).isTrainingMatch(), candidate.isTrainingMatch());
                assertEquals(first.get(0).matchedVia() == MatchSource.FALLBACK_FUZZY,
                        candidate.matchedVia() == MatchSource.FALLBACK_FUZZY);
            }
        }

        @Test
        @DisplayName("Limits are clamped to [1, 100]")
        void limitsClamped() {
            assertEquals(1, matcher.match(SCOPE, "hex zinc", 0, 0.0).size());
            assertTrue(matcher.match(SCOPE, "hex zinc", 1000, 0.0).size() <= 100);
        }

        @Test
        @DisplayName("Algorithmic results respect the requested threshold")
        void thresholdRespected() {
            List<MatchCandidate> results = matcher.match(SCOPE, "hex bolt zinc", 10, 0.6);

            assertFalse(results.isEmpty());
            results.forEach(c -> assertTrue(c.finalScore() >= 0.6));
        }
    }

    @Nested
    @DisplayName("Caching and failures")
    class CachingAndFailures {

        @Test
        @DisplayName("Repeated queries are served from the cache")
        void repeatedQueriesHitCache() {
            matcher.match(SCOPE, "hex bolt zinc");
            matcher.match(SCOPE, "Hex  Bolt  Zinc");

            assertEquals(1.0, registry.get("catalog.match.cache.miss").counter().count());
            assertEquals(1.0, registry.get("catalog.match.cache.hit").counter().count());
        }

        @Test
        @DisplayName("Catalog changes bypass stale cache entries")
        void catalogChangeBypassesCache() {
            matcher.match(SCOPE, "hex washer");
            catalog.save(SCOPE, new Product("p-w", "HW-1", "Hex Washer", null, null));

            List<MatchCandidate> results = matcher.match(SCOPE, "hex washer");

            assertEquals("p-w", results.get(0).productId());
        }

        @Test
        @DisplayName("An unavailable catalog fails the query")
        void unavailableCatalogPropagates() {
            CatalogStore broken = mock(CatalogStore.class);
            when(broken.count(any())).thenThrow(new CatalogUnavailableException("catalog offline"));
            when(broken.findAll(any())).thenThrow(new CatalogUnavailableException("catalog offline"));

            try (ProductMatcher brokenMatcher = ProductMatcher.builder().catalogStore(broken).build()) {
                assertThrows(CatalogUnavailableException.class, () -> brokenMatcher.match(SCOPE, "hex bolt"));
            }
        }

        @Test
        @DisplayName("Builder requires a catalog")
        void builderRequiresCatalog() {
            assertThrows(IllegalStateException.class, () -> ProductMatcher.builder().build());
        }
    }

    @Nested
    @DisplayName("Batch matching")
    class BatchMatching {

        @Test
        @DisplayName("Batch items keep input order and isolate blank elements")
        void batchKeepsOrder() {
            List<BatchMatchItem> items = matcher.matchBatch(SCOPE,
                    List.of("hex bolt zinc", "", "safety goggles"), 3, null);

            assertEquals(3, items.size());
            assertEquals(0, items.get(0).queryIndex());
            assertEquals(2, items.get(2).queryIndex());
            assertEquals("safety goggles", items.get(2).queryText());
            assertTrue(items.get(0).hasMatches());
            assertFalse(items.get(1).hasMatches());
            assertEquals("p-gog", items.get(2).candidates().get(0).productId());
        }
    }
}
