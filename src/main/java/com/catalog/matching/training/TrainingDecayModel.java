package com.catalog.matching.training;

import com.catalog.matching.core.model.TrainingExample;

import java.time.Duration;
import java.time.Instant;

/**
 * Ages approved examples and saturates repeated evidence.
 *
 * <pre>
 * recency(days)  = 1                                    if days &lt;= graceDays
 *                = max(0, 1 - (days - graceDays) / spanDays)  otherwise
 * evidence(n)    = 1 - exp(-n / saturation)
 * </pre>
 *
 * Evaluated lazily at read time; stored examples are never rewritten by decay.
 */
public class TrainingDecayModel {

    private final double graceDays;
    private final double spanDays;
    private final double saturation;

    public TrainingDecayModel() {
        this(90, 365, 3.0);
    }

    /**
     * @param graceDays  age before decay starts
     * @param spanDays   days over which the factor falls from 1 to 0 after the grace period
     * @param saturation example count at which evidence reaches about 63%
     */
    public TrainingDecayModel(double graceDays, double spanDays, double saturation) {
        if (graceDays < 0.0) {
            throw new IllegalArgumentException("graceDays must be non-negative");
        }
        if (spanDays <= 0.0) {
            throw new IllegalArgumentException("spanDays must be > 0");
        }
        if (saturation <= 0.0) {
            throw new IllegalArgumentException("saturation must be > 0");
        }
        this.graceDays = graceDays;
        this.spanDays = spanDays;
        this.saturation = saturation;
    }

    public double recencyFactor(TrainingExample example, Instant now) {
        return recencyFactor(example.getApprovedAt(), now);
    }

    public double recencyFactor(Instant approvedAt, Instant now) {
        if (approvedAt == null) {
            return 1.0;
        }
        double days = Duration.between(approvedAt, now).toSeconds() / 86400.0;
        if (days <= graceDays) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - (days - graceDays) / spanDays);
    }

    /**
     * Confidence multiplier for an aggregate backed by {@code count} examples.
     */
    public double evidenceFactor(int count) {
        if (count <= 0) {
            return 0.0;
        }
        return 1.0 - Math.exp(-count / saturation);
    }

    public double getGraceDays() {
        return graceDays;
    }

    public double getSpanDays() {
        return spanDays;
    }
}
