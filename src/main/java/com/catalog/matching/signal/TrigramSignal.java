package com.catalog.matching.signal;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.similarity.TrigramSimilarity;

/**
 * Trigram overlap between the normalized query and the product's name, SKU or manufacturer;
 * the best field wins.
 */
public class TrigramSignal implements ProductSignal {

    private final ProductTextIndex textIndex;
    private final TrigramSimilarity trigram = new TrigramSimilarity();

    public TrigramSignal(ProductTextIndex textIndex) {
        this.textIndex = textIndex;
    }

    @Override
    public SignalType type() {
        return SignalType.TRIGRAM;
    }

    @Override
    public double score(QueryContext query, Product product) {
        if (query.normalizedText().isEmpty()) {
            return 0.0;
        }
        double best = 0.0;
        for (String field : textIndex.texts(product).fields()) {
            best = Math.max(best, trigram.compute(query.normalizedText(), field));
        }
        return best;
    }
}
