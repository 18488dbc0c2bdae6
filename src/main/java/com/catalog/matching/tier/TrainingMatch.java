package com.catalog.matching.tier;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.TrainingExample;

/**
 * An approved example similar to the query, with the catalog product it points at.
 */
public record TrainingMatch(TrainingExample example, Product product, double similarity) {
}
