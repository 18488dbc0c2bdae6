package com.catalog.matching.signal;

import com.catalog.matching.core.model.Alias;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.similarity.ProductTextSimilarity;

/**
 * Scores a query against a single alias. An exact normalized-name hit returns the alias
 * confidence; otherwise confidence × similarity, or 0 when similarity is at or below the floor.
 * An alias SKU appearing as a token of the query counts as full similarity.
 */
public class AliasMatcher {

    private final NormalizationEngine normalizer;
    private final ProductTextSimilarity productText = new ProductTextSimilarity();
    private final double floor;

    public AliasMatcher(NormalizationEngine normalizer, double floor) {
        this.normalizer = normalizer;
        this.floor = floor;
    }

    public double score(QueryContext query, Alias alias) {
        String normalizedQuery = query.normalizedText();
        if (normalizedQuery.isEmpty()) {
            return 0.0;
        }
        if (normalizedQuery.equals(alias.getNormalizedName())) {
            return alias.getConfidence();
        }

        double similarity = productText.compute(normalizedQuery, alias.getNormalizedName());
        if (skuMentioned(normalizedQuery, alias.getExternalSku())) {
            similarity = 1.0;
        }
        if (similarity <= floor) {
            return 0.0;
        }
        return alias.getConfidence() * similarity;
    }

    public double getFloor() {
        return floor;
    }

    private boolean skuMentioned(String normalizedQuery, String externalSku) {
        if (externalSku == null || externalSku.isBlank()) {
            return false;
        }
        String sku = normalizer.normalize(externalSku);
        if (sku.isEmpty()) {
            return false;
        }
        return (" " + normalizedQuery + " ").contains(" " + sku + " ");
    }
}
