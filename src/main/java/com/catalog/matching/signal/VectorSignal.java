package com.catalog.matching.signal;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.similarity.CosineSimilarity;
import com.catalog.matching.store.CatalogStore;

import java.util.Optional;

/**
 * Cosine similarity between the query embedding and the product's stored embedding.
 * Scores 0 when either vector is missing.
 */
public class VectorSignal implements ProductSignal {

    private final CatalogStore catalogStore;

    public VectorSignal(CatalogStore catalogStore) {
        this.catalogStore = catalogStore;
    }

    @Override
    public SignalType type() {
        return SignalType.VECTOR;
    }

    @Override
    public double score(QueryContext query, Product product) {
        Optional<float[]> queryVector = query.queryEmbedding();
        if (queryVector.isEmpty()) {
            return 0.0;
        }
        return catalogStore.findEmbedding(query.scope(), product.id())
                .map(productVector -> CosineSimilarity.compute(queryVector.get(), productVector))
                .orElse(0.0);
    }
}
