package com.catalog.matching.signal;

import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.similarity.ProductTextSimilarity;
import com.catalog.matching.similarity.TrigramSimilarity;

/**
 * Similarity between a query and the text of an approved example: the best of trigram overlap
 * on normalized text, trigram overlap on the literal text, and blended product-text similarity.
 * Identical normalized texts score exactly 1.0.
 */
public class TrainingSimilarity {

    private final NormalizationEngine normalizer;
    private final TrigramSimilarity trigram = new TrigramSimilarity();
    private final ProductTextSimilarity productText = new ProductTextSimilarity();

    public TrainingSimilarity(NormalizationEngine normalizer) {
        this.normalizer = normalizer;
    }

    public double compute(QueryContext query, TrainingExample example) {
        String normalizedQuery = query.normalizedText();
        if (normalizedQuery.isEmpty() || example.getNormalizedText().isEmpty()) {
            return 0.0;
        }
        if (normalizedQuery.equals(example.getNormalizedText())) {
            return 1.0;
        }

        double normalized = trigram.compute(normalizedQuery, example.getNormalizedText());
        double literal = trigram.compute(query.canonicalText(), normalizer.canonicalize(example.getLineItemText()));
        double blended = productText.compute(normalizedQuery, example.getNormalizedText());
        return Math.min(1.0, Math.max(normalized, Math.max(literal, blended)));
    }
}
