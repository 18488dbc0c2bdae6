package com.catalog.matching.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A human-approved pairing of line-item text with a catalog product.
 * Instances are immutable; stores replace them through {@link #toBuilder()}.
 */
public class TrainingExample {
    private final String id;
    private final CatalogScope scope;
    private final String lineItemText;
    private final String normalizedText;
    private final String productId;
    private final String productSku;
    private final String productName;
    private final SignalScores scores;
    private final double finalScore;
    private final MatchQuality quality;
    private final double confidence;
    private final double weight;
    private final long referenceCount;
    private final String approvedBy;
    private final Instant approvedAt;
    private final Instant lastReferencedAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TrainingExample(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.scope = builder.scope;
        this.lineItemText = builder.lineItemText;
        this.normalizedText = builder.normalizedText;
        this.productId = builder.productId;
        this.productSku = builder.productSku;
        this.productName = builder.productName;
        this.scores = builder.scores != null ? builder.scores : SignalScores.ZERO;
        this.finalScore = builder.finalScore;
        this.quality = builder.quality;
        this.confidence = builder.confidence;
        this.weight = builder.weight;
        this.referenceCount = builder.referenceCount;
        this.approvedBy = builder.approvedBy;
        this.approvedAt = builder.approvedAt != null ? builder.approvedAt : Instant.now();
        this.lastReferencedAt = builder.lastReferencedAt;
        this.createdAt = builder.createdAt != null ? builder.createdAt : this.approvedAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public CatalogScope getScope() {
        return scope;
    }

    public String getLineItemText() {
        return lineItemText;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public String getProductId() {
        return productId;
    }

    public String getProductSku() {
        return productSku;
    }

    public String getProductName() {
        return productName;
    }

    public SignalScores getScores() {
        return scores;
    }

    public double getFinalScore() {
        return finalScore;
    }

    public MatchQuality getQuality() {
        return quality;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getWeight() {
        return weight;
    }

    public long getReferenceCount() {
        return referenceCount;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    public Instant getApprovedAt() {
        return approvedAt;
    }

    public Instant getLastReferencedAt() {
        return lastReferencedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Copy of this example with the reference counter bumped.
     */
    public TrainingExample referenced(Instant at) {
        return toBuilder()
                .referenceCount(referenceCount + 1)
                .lastReferencedAt(at)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .scope(scope)
                .lineItemText(lineItemText)
                .normalizedText(normalizedText)
                .productId(productId)
                .productSku(productSku)
                .productName(productName)
                .scores(scores)
                .finalScore(finalScore)
                .quality(quality)
                .confidence(confidence)
                .weight(weight)
                .referenceCount(referenceCount)
                .approvedBy(approvedBy)
                .approvedAt(approvedAt)
                .lastReferencedAt(lastReferencedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TrainingExample that = (TrainingExample) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TrainingExample{" +
                "id='" + id + '\'' +
                ", normalizedText='" + normalizedText + '\'' +
                ", productId='" + productId + '\'' +
                ", quality=" + quality +
                ", weight=" + weight +
                ", referenceCount=" + referenceCount +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private CatalogScope scope;
        private String lineItemText;
        private String normalizedText;
        private String productId;
        private String productSku;
        private String productName;
        private SignalScores scores;
        private double finalScore;
        private MatchQuality quality = MatchQuality.GOOD;
        private double confidence = 0.8;
        private double weight = 1.0;
        private long referenceCount = 0;
        private String approvedBy;
        private Instant approvedAt;
        private Instant lastReferencedAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder scope(CatalogScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder lineItemText(String lineItemText) {
            this.lineItemText = lineItemText;
            return this;
        }

        public Builder normalizedText(String normalizedText) {
            this.normalizedText = normalizedText;
            return this;
        }

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder productSku(String productSku) {
            this.productSku = productSku;
            return this;
        }

        public Builder productName(String productName) {
            this.productName = productName;
            return this;
        }

        public Builder scores(SignalScores scores) {
            this.scores = scores;
            return this;
        }

        public Builder finalScore(double finalScore) {
            this.finalScore = finalScore;
            return this;
        }

        public Builder quality(MatchQuality quality) {
            this.quality = quality;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder referenceCount(long referenceCount) {
            this.referenceCount = referenceCount;
            return this;
        }

        public Builder approvedBy(String approvedBy) {
            this.approvedBy = approvedBy;
            return this;
        }

        public Builder approvedAt(Instant approvedAt) {
            this.approvedAt = approvedAt;
            return this;
        }

        public Builder lastReferencedAt(Instant lastReferencedAt) {
            this.lastReferencedAt = lastReferencedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TrainingExample build() {
            Objects.requireNonNull(scope, "scope is required");
            Objects.requireNonNull(normalizedText, "normalizedText is required");
            Objects.requireNonNull(productId, "productId is required");
            Objects.requireNonNull(quality, "quality is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            if (finalScore < 0.0 || finalScore > 1.0) {
                throw new IllegalArgumentException("finalScore must be between 0.0 and 1.0");
            }
            if (weight < 0.0) {
                throw new IllegalArgumentException("weight must be >= 0");
            }
            if (lineItemText == null) {
                lineItemText = normalizedText;
            }
            return new TrainingExample(this);
        }
    }
}
