package com.catalog.matching.store;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.Product;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to the product catalog of a scope.
 * Every method may throw {@link CatalogUnavailableException}.
 */
public interface CatalogStore {

    List<Product> findAll(CatalogScope scope);

    Optional<Product> findById(CatalogScope scope, String productId);

    Optional<Product> findBySku(CatalogScope scope, String sku);

    /**
     * Products whose normalized name, SKU or manufacturer share at least one blocking key.
     */
    List<Product> findByBlockingKeys(CatalogScope scope, Set<String> blockingKeys);

    int count(CatalogScope scope);

    /**
     * Stored embedding for a product, if the catalog carries one.
     */
    Optional<float[]> findEmbedding(CatalogScope scope, String productId);

    /**
     * Monotonic change counter used to key cached results.
     */
    long version(CatalogScope scope);
}
