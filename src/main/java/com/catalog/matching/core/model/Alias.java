package com.catalog.matching.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An external (competitor or vendor) name for a catalog product, with a confidence.
 */
public class Alias {
    private final String id;
    private final CatalogScope scope;
    private final String productId;
    private final String externalName;
    private final String normalizedName;
    private final String externalSku;
    private final double confidence;
    private final AliasSource source;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Alias(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.scope = builder.scope;
        this.productId = builder.productId;
        this.externalName = builder.externalName;
        this.normalizedName = builder.normalizedName;
        this.externalSku = builder.externalSku;
        this.confidence = builder.confidence;
        this.source = builder.source;
        this.createdBy = builder.createdBy;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public CatalogScope getScope() {
        return scope;
    }

    public String getProductId() {
        return productId;
    }

    public String getExternalName() {
        return externalName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getExternalSku() {
        return externalSku;
    }

    public double getConfidence() {
        return confidence;
    }

    public AliasSource getSource() {
        return source;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .scope(scope)
                .productId(productId)
                .externalName(externalName)
                .normalizedName(normalizedName)
                .externalSku(externalSku)
                .confidence(confidence)
                .source(source)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Alias alias = (Alias) o;
        return Objects.equals(id, alias.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Alias{" +
                "externalName='" + externalName + '\'' +
                ", productId='" + productId + '\'' +
                ", confidence=" + confidence +
                ", source=" + source +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private CatalogScope scope;
        private String productId;
        private String externalName;
        private String normalizedName;
        private String externalSku;
        private double confidence = 1.0;
        private AliasSource source = AliasSource.MANUAL;
        private String createdBy;
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

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder externalName(String externalName) {
            this.externalName = externalName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder externalSku(String externalSku) {
            this.externalSku = externalSku;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder source(AliasSource source) {
            this.source = source;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
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

        public Alias build() {
            Objects.requireNonNull(scope, "scope is required");
            Objects.requireNonNull(productId, "productId is required");
            Objects.requireNonNull(normalizedName, "normalizedName is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            if (externalName == null) {
                externalName = normalizedName;
            }
            return new Alias(this);
        }
    }
}
