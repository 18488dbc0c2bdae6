package com.catalog.matching.store;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.TrainingExample;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for approved training examples.
 */
public interface TrainingDataStore {

    /**
     * Every example in the scope, whatever its quality or age.
     */
    List<TrainingExample> findAll(CatalogScope scope);

    /**
     * Examples of trainable quality (EXCELLENT or GOOD) approved at or after the given instant.
     */
    List<TrainingExample> findTrainable(CatalogScope scope, Instant approvedSince);

    List<TrainingExample> findByProduct(CatalogScope scope, String productId);

    Optional<TrainingExample> findById(CatalogScope scope, String exampleId);

    Optional<TrainingExample> findByKey(CatalogScope scope, String normalizedText, String productId);

    /**
     * Inserts or replaces an example by id.
     *
     * @throws PersistenceException if the write fails
     */
    TrainingExample save(TrainingExample example);

    /**
     * Bumps the reference counter of an example. Does not change the store version: counters
     * play no part in scoring.
     *
     * @return the updated example, or empty if it no longer exists
     * @throws PersistenceException if the write fails
     */
    Optional<TrainingExample> recordReference(CatalogScope scope, String exampleId, Instant at);

    int count(CatalogScope scope);

    long version(CatalogScope scope);
}
