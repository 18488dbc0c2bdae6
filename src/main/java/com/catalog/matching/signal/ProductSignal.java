package com.catalog.matching.signal;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalType;

/**
 * One independent similarity signal between a line item and a catalog product.
 * Implementations may throw; {@link SignalEvaluator} turns failures into a zero score.
 */
public interface ProductSignal {

    SignalType type();

    /**
     * @return similarity in [0,1]
     */
    double score(QueryContext query, Product product);
}
