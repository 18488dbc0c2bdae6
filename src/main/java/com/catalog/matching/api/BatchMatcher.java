package com.catalog.matching.api;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.logging.LogContext;
import com.catalog.matching.metrics.MetricsService;
import com.catalog.matching.store.CatalogUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Runs the queries of a batch concurrently on a fixed worker pool.
 *
 * <p>Each element is isolated: a failed or timed-out query yields an empty result at its index.
 * A timed-out query is interrupted so its worker returns to the pool. A
 * {@link CatalogUnavailableException} fails the whole batch.</p>
 */
public class BatchMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchMatcher.class);

    private final BiFunction<CatalogScope, MatchQuery, List<MatchCandidate>> matcher;
    private final ExecutorService executor;
    private final long timeoutNanos;
    private final MetricsService metricsService;

    public BatchMatcher(BiFunction<CatalogScope, MatchQuery, List<MatchCandidate>> matcher,
                        MatchOptions options,
                        MetricsService metricsService) {
        this.matcher = matcher;
        this.executor = Executors.newFixedThreadPool(options.getBatchParallelism(), workerFactory());
        this.timeoutNanos = options.getQueryTimeout().toNanos();
        this.metricsService = metricsService;
    }

    public List<BatchMatchItem> matchAll(CatalogScope scope, List<String> texts, Integer limit, Double threshold) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        String batchId = LogContext.generateCorrelationId();
        try (LogContext ignored = LogContext.forBatch(batchId, scope.tenantId())) {
            metricsService.recordBatchSize(texts.size());
            long start = System.nanoTime();

            List<Future<List<MatchCandidate>>> futures = new ArrayList<>(texts.size());
            List<Long> deadlines = new ArrayList<>(texts.size());
            for (String text : texts) {
                MatchQuery query = new MatchQuery(text, limit, threshold);
                deadlines.add(System.nanoTime() + timeoutNanos);
                futures.add(executor.submit(() -> matcher.apply(scope, query)));
            }

            List<BatchMatchItem> items = new ArrayList<>(texts.size());
            for (int i = 0; i < texts.size(); i++) {
                items.add(new BatchMatchItem(i, texts.get(i), await(futures, deadlines.get(i), i)));
            }

            long matched = items.stream().filter(BatchMatchItem::hasMatches).count();
            log.info("batch.completed size={} matched={} elapsedMs={}",
                    texts.size(), matched, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return items;
        }
    }

    /**
     * Waits for one element until its deadline. A timed-out element is cancelled with
     * interruption so it releases its worker.
     */
    private List<MatchCandidate> await(List<Future<List<MatchCandidate>>> futures, long deadline, int index) {
        Future<List<MatchCandidate>> future = futures.get(index);
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("batch.element_timeout index={} timeoutMs={}",
                    index, TimeUnit.NANOSECONDS.toMillis(timeoutNanos));
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CatalogUnavailableException unavailable) {
                futures.forEach(f -> f.cancel(true));
                throw unavailable;
            }
            log.warn("batch.element_failed index={} error={}", index, cause.toString());
            return List.of();
        } catch (CancellationException e) {
            log.warn("batch.element_cancelled index={}", index);
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            log.warn("batch.interrupted index={}", index);
            return List.of();
        }
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "catalog-match-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
