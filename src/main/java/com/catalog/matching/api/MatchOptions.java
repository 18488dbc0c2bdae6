package com.catalog.matching.api;

import com.catalog.matching.similarity.SignalWeights;

import java.time.Duration;

/**
 * Tuning for matching and feedback recording. Every weight, threshold and window used by the
 * tiers, signals and retriever is read from here.
 */
public class MatchOptions {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;
    public static final double DEFAULT_THRESHOLD = 0.3;

    private static final double DEFAULT_EXACT_TRAINING_THRESHOLD = 0.95;
    private static final double DEFAULT_GOOD_TRAINING_THRESHOLD = 0.80;
    private static final double DEFAULT_TRAINING_PREFILTER = 0.5;
    private static final int DEFAULT_FUZZY_MAX_DISTANCE = 8;
    private static final double DEFAULT_ALIAS_FLOOR = 0.25;
    private static final Duration DEFAULT_LEARNED_WINDOW = Duration.ofDays(180);
    private static final double DEFAULT_LEARNED_MIN_SIMILARITY = 0.6;
    private static final int DEFAULT_LEARNED_MAX_EXAMPLES = 10;
    private static final double DEFAULT_RETRIEVAL_FLOOR = 0.12;
    private static final double DEFAULT_FALLBACK_FLOOR = 0.10;
    private static final int DEFAULT_MAX_CANDIDATES = 200;
    private static final int DEFAULT_FULL_SCAN_LIMIT = 300;
    private static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_APPROVAL_ATTEMPTS = 3;
    private static final Duration DEFAULT_APPROVAL_RETRY_DELAY = Duration.ofMillis(50);
    private static final int DEFAULT_ALIAS_MIN_TEXT_LENGTH = 3;

    private final int defaultLimit;
    private final double defaultThreshold;
    private final double exactTrainingThreshold;
    private final double goodTrainingThreshold;
    private final double trainingPrefilter;
    private final SignalWeights signalWeights;
    private final int fuzzyMaxDistance;
    private final double aliasFloor;
    private final Duration learnedWindow;
    private final double learnedMinSimilarity;
    private final int learnedMaxExamples;
    private final double retrievalFloor;
    private final double fallbackFloor;
    private final int maxCandidates;
    private final int fullScanLimit;
    private final Duration queryTimeout;
    private final int batchParallelism;
    private final int approvalAttempts;
    private final Duration approvalRetryDelay;
    private final int aliasMinTextLength;
    private final boolean trackReferences;

    private MatchOptions(Builder builder) {
        this.defaultLimit = builder.defaultLimit;
        this.defaultThreshold = builder.defaultThreshold;
        this.exactTrainingThreshold = builder.exactTrainingThreshold;
        this.goodTrainingThreshold = builder.goodTrainingThreshold;
        this.trainingPrefilter = builder.trainingPrefilter;
        this.signalWeights = builder.signalWeights;
        this.fuzzyMaxDistance = builder.fuzzyMaxDistance;
        this.aliasFloor = builder.aliasFloor;
        this.learnedWindow = builder.learnedWindow;
        this.learnedMinSimilarity = builder.learnedMinSimilarity;
        this.learnedMaxExamples = builder.learnedMaxExamples;
        this.retrievalFloor = builder.retrievalFloor;
        this.fallbackFloor = builder.fallbackFloor;
        this.maxCandidates = builder.maxCandidates;
        this.fullScanLimit = builder.fullScanLimit;
        this.queryTimeout = builder.queryTimeout;
        this.batchParallelism = builder.batchParallelism;
        this.approvalAttempts = builder.approvalAttempts;
        this.approvalRetryDelay = builder.approvalRetryDelay;
        this.aliasMinTextLength = builder.aliasMinTextLength;
        this.trackReferences = builder.trackReferences;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    /**
     * Minimum training similarity for an exact (tier 1) hit.
     */
    public double getExactTrainingThreshold() {
        return exactTrainingThreshold;
    }

    /**
     * Minimum training similarity for a high-confidence (tier 2) hit.
     */
    public double getGoodTrainingThreshold() {
        return goodTrainingThreshold;
    }

    public double getTrainingPrefilter() {
        return trainingPrefilter;
    }

    public SignalWeights getSignalWeights() {
        return signalWeights;
    }

    public int getFuzzyMaxDistance() {
        return fuzzyMaxDistance;
    }

    public double getAliasFloor() {
        return aliasFloor;
    }

    public Duration getLearnedWindow() {
        return learnedWindow;
    }

    public double getLearnedMinSimilarity() {
        return learnedMinSimilarity;
    }

    public int getLearnedMaxExamples() {
        return learnedMaxExamples;
    }

    public double getRetrievalFloor() {
        return retrievalFloor;
    }

    public double getFallbackFloor() {
        return fallbackFloor;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public int getFullScanLimit() {
        return fullScanLimit;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    public int getApprovalAttempts() {
        return approvalAttempts;
    }

    public Duration getApprovalRetryDelay() {
        return approvalRetryDelay;
    }

    public int getAliasMinTextLength() {
        return aliasMinTextLength;
    }

    public boolean isTrackReferences() {
        return trackReferences;
    }

    /**
     * Clamps a requested limit to [1, 100]; null selects the default.
     */
    public int effectiveLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(MAX_LIMIT, requested));
    }

    /**
     * Clamps a requested threshold to [0, 1]; null or NaN selects the default.
     */
    public double effectiveThreshold(Double requested) {
        if (requested == null || requested.isNaN()) {
            return defaultThreshold;
        }
        return Math.max(0.0, Math.min(1.0, requested));
    }

    public static MatchOptions defaults() {
        return builder().build();
    }

    /**
     * Higher bar for training hits and algorithmic results.
     */
    public static MatchOptions strict() {
        return builder()
                .defaultThreshold(0.5)
                .exactTrainingThreshold(0.98)
                .goodTrainingThreshold(0.88)
                .build();
    }

    /**
     * Wider retrieval and a lower default threshold, for sparse catalogs.
     */
    public static MatchOptions lenient() {
        return builder()
                .defaultThreshold(0.2)
                .retrievalFloor(0.08)
                .fallbackFloor(0.05)
                .maxCandidates(400)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .defaultLimit(defaultLimit)
                .defaultThreshold(defaultThreshold)
                .exactTrainingThreshold(exactTrainingThreshold)
                .goodTrainingThreshold(goodTrainingThreshold)
                .trainingPrefilter(trainingPrefilter)
                .signalWeights(signalWeights)
                .fuzzyMaxDistance(fuzzyMaxDistance)
                .aliasFloor(aliasFloor)
                .learnedWindow(learnedWindow)
                .learnedMinSimilarity(learnedMinSimilarity)
                .learnedMaxExamples(learnedMaxExamples)
                .retrievalFloor(retrievalFloor)
                .fallbackFloor(fallbackFloor)
                .maxCandidates(maxCandidates)
                .fullScanLimit(fullScanLimit)
                .queryTimeout(queryTimeout)
                .batchParallelism(batchParallelism)
                .approvalAttempts(approvalAttempts)
                .approvalRetryDelay(approvalRetryDelay)
                .aliasMinTextLength(aliasMinTextLength)
                .trackReferences(trackReferences);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int defaultLimit = DEFAULT_LIMIT;
        private double defaultThreshold = DEFAULT_THRESHOLD;
        private double exactTrainingThreshold = DEFAULT_EXACT_TRAINING_THRESHOLD;
        private double goodTrainingThreshold = DEFAULT_GOOD_TRAINING_THRESHOLD;
        private double trainingPrefilter = DEFAULT_TRAINING_PREFILTER;
        private SignalWeights signalWeights = SignalWeights.defaultWeights();
        private int fuzzyMaxDistance = DEFAULT_FUZZY_MAX_DISTANCE;
        private double aliasFloor = DEFAULT_ALIAS_FLOOR;
        private Duration learnedWindow = DEFAULT_LEARNED_WINDOW;
        private double learnedMinSimilarity = DEFAULT_LEARNED_MIN_SIMILARITY;
        private int learnedMaxExamples = DEFAULT_LEARNED_MAX_EXAMPLES;
        private double retrievalFloor = DEFAULT_RETRIEVAL_FLOOR;
        private double fallbackFloor = DEFAULT_FALLBACK_FLOOR;
        private int maxCandidates = DEFAULT_MAX_CANDIDATES;
        private int fullScanLimit = DEFAULT_FULL_SCAN_LIMIT;
        private Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;
        private int batchParallelism = Runtime.getRuntime().availableProcessors();
        private int approvalAttempts = DEFAULT_APPROVAL_ATTEMPTS;
        private Duration approvalRetryDelay = DEFAULT_APPROVAL_RETRY_DELAY;
        private int aliasMinTextLength = DEFAULT_ALIAS_MIN_TEXT_LENGTH;
        private boolean trackReferences = true;

        public Builder defaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
            return this;
        }

        public Builder defaultThreshold(double defaultThreshold) {
            this.defaultThreshold = defaultThreshold;
            return this;
        }

        public Builder exactTrainingThreshold(double exactTrainingThreshold) {
            this.exactTrainingThreshold = exactTrainingThreshold;
            return this;
        }

        public Builder goodTrainingThreshold(double goodTrainingThreshold) {
            this.goodTrainingThreshold = goodTrainingThreshold;
            return this;
        }

        public Builder trainingPrefilter(double trainingPrefilter) {
            this.trainingPrefilter = trainingPrefilter;
            return this;
        }

        public Builder signalWeights(SignalWeights signalWeights) {
            this.signalWeights = signalWeights;
            return this;
        }

        public Builder fuzzyMaxDistance(int fuzzyMaxDistance) {
            this.fuzzyMaxDistance = fuzzyMaxDistance;
            return this;
        }

        public Builder aliasFloor(double aliasFloor) {
            this.aliasFloor = aliasFloor;
            return this;
        }

        public Builder learnedWindow(Duration learnedWindow) {
            this.learnedWindow = learnedWindow;
            return this;
        }

        public Builder learnedMinSimilarity(double learnedMinSimilarity) {
            this.learnedMinSimilarity = learnedMinSimilarity;
            return this;
        }

        public Builder learnedMaxExamples(int learnedMaxExamples) {
            this.learnedMaxExamples = learnedMaxExamples;
            return this;
        }

        public Builder retrievalFloor(double retrievalFloor) {
            this.retrievalFloor = retrievalFloor;
            return this;
        }

        public Builder fallbackFloor(double fallbackFloor) {
            this.fallbackFloor = fallbackFloor;
            return this;
        }

        public Builder maxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
            return this;
        }

        public Builder fullScanLimit(int fullScanLimit) {
            this.fullScanLimit = fullScanLimit;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder batchParallelism(int batchParallelism) {
            this.batchParallelism = batchParallelism;
            return this;
        }

        public Builder approvalAttempts(int approvalAttempts) {
            this.approvalAttempts = approvalAttempts;
            return this;
        }

        public Builder approvalRetryDelay(Duration approvalRetryDelay) {
            this.approvalRetryDelay = approvalRetryDelay;
            return this;
        }

        public Builder aliasMinTextLength(int aliasMinTextLength) {
            this.aliasMinTextLength = aliasMinTextLength;
            return this;
        }

        public Builder trackReferences(boolean trackReferences) {
            this.trackReferences = trackReferences;
            return this;
        }

        public MatchOptions build() {
            validateThreshold(defaultThreshold, "defaultThreshold");
            validateThreshold(exactTrainingThreshold, "exactTrainingThreshold");
            validateThreshold(goodTrainingThreshold, "goodTrainingThreshold");
            validateThreshold(trainingPrefilter, "trainingPrefilter");
            validateThreshold(aliasFloor, "aliasFloor");
            validateThreshold(learnedMinSimilarity, "learnedMinSimilarity");
            validateThreshold(retrievalFloor, "retrievalFloor");
            validateThreshold(fallbackFloor, "fallbackFloor");
            if (exactTrainingThreshold < goodTrainingThreshold) {
                throw new IllegalArgumentException("exactTrainingThreshold must be >= goodTrainingThreshold");
            }
            if (fallbackFloor > retrievalFloor) {
                throw new IllegalArgumentException("fallbackFloor must be <= retrievalFloor");
            }
            if (defaultLimit < 1 || defaultLimit > MAX_LIMIT) {
                throw new IllegalArgumentException("defaultLimit must be between 1 and " + MAX_LIMIT);
            }
            if (signalWeights == null) {
                throw new IllegalArgumentException("signalWeights is required");
            }
            if (maxCandidates < 1 || fullScanLimit < 0 || learnedMaxExamples < 1 || fuzzyMaxDistance < 0) {
                throw new IllegalArgumentException("candidate and example bounds must be positive");
            }
            if (batchParallelism < 1 || approvalAttempts < 1) {
                throw new IllegalArgumentException("batchParallelism and approvalAttempts must be >= 1");
            }
            if (learnedWindow == null || queryTimeout == null || approvalRetryDelay == null) {
                throw new IllegalArgumentException("durations are required");
            }
            return new MatchOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchOptions{" +
                "defaultLimit=" + defaultLimit +
                ", defaultThreshold=" + defaultThreshold +
                ", exactTrainingThreshold=" + exactTrainingThreshold +
                ", goodTrainingThreshold=" + goodTrainingThreshold +
                ", signalWeights=" + signalWeights +
                ", retrievalFloor=" + retrievalFloor +
                ", fallbackFloor=" + fallbackFloor +
                ", maxCandidates=" + maxCandidates +
                '}';
    }
}
