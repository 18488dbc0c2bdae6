package com.catalog.matching.signal;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.rules.DimensionSpec;
import com.catalog.matching.rules.NormalizationEngine;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Everything the signals need to know about one line item, computed once per query.
 * The query embedding is fetched on first use, so training-tier hits never pay for it.
 */
public final class QueryContext {

    private final CatalogScope scope;
    private final String rawText;
    private final String normalizedText;
    private final String canonicalText;
    private final DimensionSpec dimensions;
    private final Instant now;
    private final Supplier<float[]> embeddingSupplier;

    private boolean embeddingResolved;
    private float[] embedding;

    private QueryContext(CatalogScope scope, String rawText, String normalizedText, String canonicalText,
                         Instant now, Supplier<float[]> embeddingSupplier) {
        this.scope = Objects.requireNonNull(scope, "scope is required");
        this.rawText = rawText;
        this.normalizedText = normalizedText;
        this.canonicalText = canonicalText;
        this.dimensions = DimensionSpec.extract(rawText);
        this.now = Objects.requireNonNull(now, "now is required");
        this.embeddingSupplier = embeddingSupplier;
    }

    /**
     * @param embeddingSupplier supplies the query embedding or null; must not throw
     */
    public static QueryContext create(CatalogScope scope, String rawText, NormalizationEngine normalizer,
                                      Instant now, Supplier<float[]> embeddingSupplier) {
        return new QueryContext(scope, rawText, normalizer.normalize(rawText), normalizer.canonicalize(rawText),
                now, embeddingSupplier);
    }

    public static QueryContext create(CatalogScope scope, String rawText, NormalizationEngine normalizer, Instant now) {
        return create(scope, rawText, normalizer, now, null);
    }

    public CatalogScope scope() {
        return scope;
    }

    public String rawText() {
        return rawText;
    }

    /**
     * Rule-normalized text (abbreviations expanded, punctuation stripped).
     */
    public String normalizedText() {
        return normalizedText;
    }

    /**
     * Lowercased, whitespace-collapsed literal text.
     */
    public String canonicalText() {
        return canonicalText;
    }

    public DimensionSpec dimensions() {
        return dimensions;
    }

    public Instant now() {
        return now;
    }

    public synchronized Optional<float[]> queryEmbedding() {
        if (!embeddingResolved) {
            embedding = embeddingSupplier != null ? embeddingSupplier.get() : null;
            embeddingResolved = true;
        }
        return Optional.ofNullable(embedding);
    }
}
