package com.catalog.matching.training;

import com.catalog.matching.core.model.CatalogScope;

import java.util.Collection;

/**
 * Notified when approved examples answered a query. Implementations must not throw.
 */
@FunctionalInterface
public interface TrainingReferenceListener {

    TrainingReferenceListener NONE = (scope, exampleIds) -> { };

    void onExamplesReferenced(CatalogScope scope, Collection<String> exampleIds);
}
