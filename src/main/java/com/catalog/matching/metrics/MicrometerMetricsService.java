package com.catalog.matching.metrics;

import com.catalog.matching.core.model.SignalType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.match.duration} Timer (tag: tier)</li>
 *   <li>{@code catalog.match.tier.hit} Counter (tag: tier)</li>
 *   <li>{@code catalog.match.signal.failure} Counter (tag: signal)</li>
 *   <li>{@code catalog.match.candidates} DistributionSummary</li>
 *   <li>{@code catalog.match.top.score} DistributionSummary</li>
 *   <li>{@code catalog.match.batch.size} DistributionSummary</li>
 *   <li>{@code catalog.training.approval} Counter (tag: outcome)</li>
 *   <li>{@code catalog.training.alias.upserted} Counter</li>
 *   <li>{@code catalog.match.cache.hit} / {@code catalog.match.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary candidateSummary;
    private final DistributionSummary topScoreSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter approvalRecordedCounter;
    private final Counter approvalFailedCounter;
    private final Counter aliasUpsertedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.candidateSummary = DistributionSummary.builder("catalog.match.candidates")
                .description("Candidates returned per tier evaluation")
                .register(registry);
        this.topScoreSummary = DistributionSummary.builder("catalog.match.top.score")
                .description("Final score of the best candidate returned")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("catalog.match.batch.size")
                .description("Number of line items per batch request")
                .register(registry);
        this.approvalRecordedCounter = Counter.builder("catalog.training.approval")
                .description("Approvals written to the training store")
                .tag("outcome", "recorded")
                .register(registry);
        this.approvalFailedCounter = Counter.builder("catalog.training.approval")
                .description("Approvals written to the training store")
                .tag("outcome", "failed")
                .register(registry);
        this.aliasUpsertedCounter = Counter.builder("catalog.training.alias.upserted")
                .description("Aliases created or refreshed from approvals")
                .register(registry);
        this.cacheHitCounter = Counter.builder("catalog.match.cache.hit")
                .description("Number of match cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("catalog.match.cache.miss")
                .description("Number of match cache misses")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(String tier, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(tier, k ->
                Timer.builder("catalog.match.duration")
                        .description("Duration of match queries by winning tier")
                        .tag("tier", tier)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTierHit(String tier) {
        counter("tier:" + tier, "catalog.match.tier.hit", "Queries answered by each tier", "tier", tier)
                .increment();
    }

    @Override
    public void incrementSignalFailure(SignalType signal) {
        counter("signal:" + signal.name(), "catalog.match.signal.failure",
                "Signal computations that failed and degraded to zero", "signal", signal.name())
                .increment();
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateSummary.record(count);
    }

    @Override
    public void recordTopScore(double score) {
        topScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementApprovalRecorded() {
        approvalRecordedCounter.increment();
    }

    @Override
    public void incrementApprovalFailed() {
        approvalFailedCounter.increment();
    }

    @Override
    public void incrementAliasUpserted() {
        aliasUpsertedCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
