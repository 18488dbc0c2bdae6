package com.catalog.matching.store;

import com.catalog.matching.core.model.Alias;
import com.catalog.matching.core.model.CatalogScope;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for external product names. Reads may fail; callers degrade the alias signal.
 */
public interface AliasStore {

    List<Alias> findAll(CatalogScope scope);

    List<Alias> findByProduct(CatalogScope scope, String productId);

    Optional<Alias> find(CatalogScope scope, String normalizedName, String productId);

    /**
     * Inserts or replaces the alias keyed by (scope, normalized name, product id).
     *
     * @throws PersistenceException if the write fails
     */
    Alias upsert(Alias alias);

    long version(CatalogScope scope);
}
