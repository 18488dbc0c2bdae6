package com.catalog.matching.retrieval;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.signal.QueryContext;

import java.util.List;

/**
 * Narrows the catalog to a bounded set of products worth scoring with every signal.
 */
public interface CandidateRetriever {

    /**
     * @return candidates in deterministic order, never null
     * @throws com.catalog.matching.store.CatalogUnavailableException if the catalog cannot be read
     */
    List<Product> retrieve(QueryContext query, RetrievalMode mode);
}
