package com.catalog.matching.signal;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.similarity.LevenshteinSimilarity;

/**
 * Bounded edit-distance similarity against name, SKU and manufacturer. Pairs more than
 * {@code maxDistance} edits apart score 0.
 */
public class FuzzySignal implements ProductSignal {

    private final ProductTextIndex textIndex;
    private final LevenshteinSimilarity levenshtein;

    public FuzzySignal(ProductTextIndex textIndex, int maxDistance) {
        this.textIndex = textIndex;
        this.levenshtein = new LevenshteinSimilarity(maxDistance);
    }

    @Override
    public SignalType type() {
        return SignalType.FUZZY;
    }

    @Override
    public double score(QueryContext query, Product product) {
        if (query.normalizedText().isEmpty()) {
            return 0.0;
        }
        double best = 0.0;
        for (String field : textIndex.texts(product).fields()) {
            best = Math.max(best, levenshtein.compute(query.normalizedText(), field));
        }
        return best;
    }
}
