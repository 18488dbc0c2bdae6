package com.catalog.matching.api;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.core.model.MatchSource;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalScores;
import com.catalog.matching.metrics.MicrometerMetricsService;
import com.catalog.matching.store.CatalogUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class BatchMatcherTest {

    private static final CatalogScope SCOPE = CatalogScope.of("acme");

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private BatchMatcher batchMatcher;

    @AfterEach
    void tearDown() {
        if (batchMatcher != null) {
            batchMatcher.close();
        }
    }

    private BatchMatcher create(BiFunction<CatalogScope, MatchQuery, List<MatchCandidate>> matcher,
                                MatchOptions options) {
        batchMatcher = new BatchMatcher(matcher, options, new MicrometerMetricsService(registry));
        return batchMatcher;
    }

    private static List<MatchCandidate> echo(MatchQuery query) {
        Product product = Product.of("p-" + query.text(), "SKU-" + query.text(), query.text());
        return List.of(new MatchCandidate(product, SignalScores.ZERO, 0.5, MatchSource.TRIGRAM, "", null));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("Should keep results aligned with input order")
    void testOrderPreserved() {
        BatchMatcher matcher = create((scope, query) -> {
            sleep(query.text().length() * 10L);
            return echo(query);
        }, MatchOptions.builder().batchParallelism(4).build());

        List<BatchMatchItem> items = matcher.matchAll(SCOPE, List.of("aaaaa", "b", "ccc", "dd"), 5, 0.3);

        assertEquals(4, items.size());
        for (int i = 0; i < items.size(); i++) {
            BatchMatchItem item = items.get(i);
            assertEquals(i, item.queryIndex());
            assertEquals("p-" + item.queryText(), item.candidates().get(0).productId());
        }
    }

    @Test
    @DisplayName("Should pass limit and threshold to every element")
    void testQueryParameters() {
        BatchMatcher matcher = create((scope, query) -> {
            assertEquals(SCOPE, scope);
            assertEquals(7, query.limit());
            assertEquals(0.4, query.threshold());
            return echo(query);
        }, MatchOptions.defaults());

        List<BatchMatchItem> items = matcher.matchAll(SCOPE, List.of("x", "y"), 7, 0.4);

        assertTrue(items.stream().allMatch(BatchMatchItem::hasMatches));
    }

    @Test
    @DisplayName("Should isolate a failing element")
    void testFailureIsolated() {
        BatchMatcher matcher = create((scope, query) -> {
            if (query.text().equals("bad")) {
                throw new IllegalStateException("boom");
            }
            return echo(query);
        }, MatchOptions.defaults());

        List<BatchMatchItem> items = matcher.matchAll(SCOPE, List.of("good", "bad", "fine"), null, null);

        assertTrue(items.get(0).hasMatches());
        assertFalse(items.get(1).hasMatches());
        assertEquals("bad", items.get(1).queryText());
        assertTrue(items.get(2).hasMatches());
    }

    @Test
    @DisplayName("Should return an empty result for a timed-out element")
    void testTimeoutIsolated() {
        BatchMatcher matcher = create((scope, query) -> {
            if (query.text().equals("slow")) {
                sleep(1500);
            }
            return echo(query);
        }, MatchOptions.builder().queryTimeout(Duration.ofMillis(200)).batchParallelism(2).build());

        List<BatchMatchItem> items = matcher.matchAll(SCOPE, List.of("slow", "quick"), null, null);

        assertFalse(items.get(0).hasMatches());
        assertTrue(items.get(1).hasMatches());
    }

    @Test
    @DisplayName("Should interrupt a timed-out element and free its worker")
    void testTimedOutElementInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        BatchMatcher matcher = create((scope, query) -> {
            if (query.text().equals("slow")) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }
            return echo(query);
        }, MatchOptions.builder().queryTimeout(Duration.ofMillis(200)).batchParallelism(1).build());

        List<BatchMatchItem> first = matcher.matchAll(SCOPE, List.of("slow"), null, null);

        assertFalse(first.get(0).hasMatches());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        List<BatchMatchItem> second = matcher.matchAll(SCOPE, List.of("quick"), null, null);
        assertTrue(second.get(0).hasMatches());
    }

    @Test
    @DisplayName("Should fail the whole batch when the catalog is unavailable")
    void testCatalogUnavailable() {
        BatchMatcher matcher = create((scope, query) -> {
            throw new CatalogUnavailableException("catalog offline");
        }, MatchOptions.defaults());

        assertThrows(CatalogUnavailableException.class,
                () -> matcher.matchAll(SCOPE, List.of("a", "b"), null, null));
    }

    @Test
    @DisplayName("Should return nothing for an empty batch")
    void testEmptyBatch() {
        BatchMatcher matcher = create((scope, query) -> echo(query), MatchOptions.defaults());

        assertTrue(matcher.matchAll(SCOPE, List.of(), null, null).isEmpty());
        assertTrue(matcher.matchAll(SCOPE, null, null, null).isEmpty());
    }

    @Test
    @DisplayName("Should record the batch size")
    void testBatchSizeMetric() {
        BatchMatcher matcher = create((scope, query) -> echo(query), MatchOptions.defaults());

        matcher.matchAll(SCOPE, List.of("a", "b", "c"), null, null);

        assertEquals(1, registry.get("catalog.match.batch.size").summary().count());
        assertEquals(3.0, registry.get("catalog.match.batch.size").summary().totalAmount());
    }
}
