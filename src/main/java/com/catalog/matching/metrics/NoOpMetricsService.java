package com.catalog.matching.metrics;

import com.catalog.matching.core.model.SignalType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(String tier, Duration duration) {
    }

    @Override
    public void incrementTierHit(String tier) {
    }

    @Override
    public void incrementSignalFailure(SignalType signal) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void recordTopScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementApprovalRecorded() {
    }

    @Override
    public void incrementApprovalFailed() {
    }

    @Override
    public void incrementAliasUpserted() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
