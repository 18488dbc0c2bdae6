package com.catalog.matching.metrics;

import com.catalog.matching.core.model.SignalType;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs without a registry.
 */
public interface MetricsService {

    void recordMatchDuration(String tier, Duration duration);

    void incrementTierHit(String tier);

    void incrementSignalFailure(SignalType signal);

    void recordCandidateCount(int count);

    void recordTopScore(double score);

    void recordBatchSize(int size);

    void incrementApprovalRecorded();

    void incrementApprovalFailed();

    void incrementAliasUpserted();

    void recordCacheHit();

    void recordCacheMiss();
}
