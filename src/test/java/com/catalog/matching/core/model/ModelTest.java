package com.catalog.matching.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core Model Tests")
class ModelTest {

    private static final CatalogScope SCOPE = CatalogScope.of("acme");
    private static final Product BOLT = Product.of("p-1", "HB-1420", "Hex Bolt 1/4-20");

    @Nested
    @DisplayName("CatalogScope")
    class CatalogScopeTests {

        @Test
        @DisplayName("Should trim the tenant id and compare by value")
        void testTrimAndEquality() {
            assertEquals(CatalogScope.of("acme"), CatalogScope.of(" acme "));
            assertEquals("acme", CatalogScope.of("acme").toString());
            assertEquals(CatalogScope.DEFAULT_TENANT, CatalogScope.defaultScope().tenantId());
        }

        @Test
        @DisplayName("Should reject blank tenant ids")
        void testBlankTenant() {
            assertThrows(IllegalArgumentException.class, () -> CatalogScope.of(" "));
            assertThrows(IllegalArgumentException.class, () -> CatalogScope.of(null));
        }
    }

    @Nested
    @DisplayName("MatchQuality")
    class MatchQualityTests {

        @Test
        @DisplayName("Should treat only EXCELLENT and GOOD as trainable")
        void testTrainable() {
            assertTrue(MatchQuality.EXCELLENT.isTrainable());
            assertTrue(MatchQuality.GOOD.isTrainable());
            assertFalse(MatchQuality.FAIR.isTrainable());
            assertFalse(MatchQuality.POOR.isTrainable());
        }

        @Test
        @DisplayName("Should parse labels case-insensitively with a fallback")
        void testParse() {
            assertEquals(MatchQuality.EXCELLENT, MatchQuality.parse(" excellent ", MatchQuality.GOOD));
            assertEquals(MatchQuality.GOOD, MatchQuality.parse("perfect", MatchQuality.GOOD));
            assertEquals(MatchQuality.FAIR, MatchQuality.parse(null, MatchQuality.FAIR));
        }

        @Test
        @DisplayName("Should boost better grades")
        void testMultipliers() {
            assertEquals(1.2, MatchQuality.EXCELLENT.learnedMultiplier());
            assertEquals(1.1, MatchQuality.GOOD.learnedMultiplier());
            assertEquals(1.0, MatchQuality.FAIR.learnedMultiplier());
        }
    }

    @Nested
    @DisplayName("SignalScores")
    class SignalScoresTests {

        @Test
        @DisplayName("Should reject components outside [0,1]")
        void testRange() {
            assertThrows(IllegalArgumentException.class, () -> new SignalScores(1.1, 0, 0, 0, 0));
            assertThrows(IllegalArgumentException.class, () -> new SignalScores(0, -0.1, 0, 0, 0));
            assertThrows(IllegalArgumentException.class, () -> new SignalScores(0, 0, Double.NaN, 0, 0));
        }

        @Test
        @DisplayName("Should report the largest component")
        void testMax() {
            assertEquals(0.7, new SignalScores(0.1, 0.2, 0.3, 0.7, 0.4).max());
            assertEquals(0.9, SignalScores.uniform(0.9).learned());
            assertEquals(0.0, SignalScores.ZERO.max());
        }
    }

    @Nested
    @DisplayName("MatchCandidate")
    class MatchCandidateTests {

        @Test
        @DisplayName("Should reject out-of-range final scores")
        void testFinalScoreRange() {
            assertThrows(IllegalArgumentException.class, () ->
                    new MatchCandidate(BOLT, SignalScores.ZERO, 1.01, MatchSource.TRIGRAM, "", null));
            assertThrows(IllegalArgumentException.class, () ->
                    new MatchCandidate(BOLT, SignalScores.ZERO, Double.NaN, MatchSource.TRIGRAM, "", null));
        }

        @Test
        @DisplayName("Should classify the match source")
        void testSourceClassification() {
            MatchCandidate training = new MatchCandidate(BOLT, SignalScores.uniform(0.97), 0.97,
                    MatchSource.TRAINING_EXACT, "approved", "ex-1");

            assertTrue(training.isTrainingMatch());
            assertEquals("p-1", training.productId());
            assertEquals("training_exact", MatchSource.TRAINING_EXACT.label());
            assertTrue(MatchSource.ALIAS.isAlgorithmic());
            assertFalse(MatchSource.FALLBACK_FUZZY.isAlgorithmic());
            assertFalse(MatchSource.FALLBACK_FUZZY.isTraining());
        }
    }

    @Nested
    @DisplayName("TrainingExample")
    class TrainingExampleTests {

        private TrainingExample.Builder valid() {
            return TrainingExample.builder()
                    .scope(SCOPE)
                    .normalizedText("hex bolt 1/4-20")
                    .productId("p-1")
                    .approvedAt(Instant.parse("2026-01-01T00:00:00Z"));
        }

        @Test
        @DisplayName("Should apply defaults")
        void testDefaults() {
            TrainingExample example = valid().build();

            assertNotNull(example.getId());
            assertEquals(MatchQuality.GOOD, example.getQuality());
            assertEquals(1.0, example.getWeight());
            assertEquals(0, example.getReferenceCount());
            assertEquals("hex bolt 1/4-20", example.getLineItemText());
            assertEquals(example.getApprovedAt(), example.getCreatedAt());
            assertEquals(SignalScores.ZERO, example.getScores());
        }

        @Test
        @DisplayName("Should validate required fields and ranges")
        void testValidation() {
            assertThrows(NullPointerException.class, () -> valid().scope(null).build());
            assertThrows(NullPointerException.class, () -> valid().productId(null).build());
            assertThrows(IllegalArgumentException.class, () -> valid().confidence(1.5).build());
            assertThrows(IllegalArgumentException.class, () -> valid().weight(-1).build());
        }

        @Test
        @DisplayName("Should bump the reference counter without changing identity")
        void testReferenced() {
            TrainingExample example = valid().id("ex-1").weight(2.0).build();
            Instant at = Instant.parse("2026-02-01T00:00:00Z");

            TrainingExample referenced = example.referenced(at).referenced(at);

            assertEquals("ex-1", referenced.getId());
            assertEquals(2, referenced.getReferenceCount());
            assertEquals(at, referenced.getLastReferencedAt());
            assertEquals(2.0, referenced.getWeight());
            assertEquals(example, referenced);
        }
    }

    @Nested
    @DisplayName("Alias")
    class AliasTests {

        @Test
        @DisplayName("Should default the external name and validate confidence")
        void testAliasBuilder() {
            Alias alias = Alias.builder().scope(SCOPE).productId("p-1").normalizedName("hx bolt").build();

            assertEquals("hx bolt", alias.getExternalName());
            assertEquals(1.0, alias.getConfidence());
            assertEquals(AliasSource.MANUAL, alias.getSource());
            assertThrows(IllegalArgumentException.class, () ->
                    Alias.builder().scope(SCOPE).productId("p-1").normalizedName("x").confidence(2.0).build());
        }
    }
}
