package com.catalog.matching.signal;

import com.catalog.matching.core.model.Alias;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.core.model.SignalType;
import com.catalog.matching.store.AliasStore;

/**
 * Best alias score over the product's known external names.
 */
public class AliasSignal implements ProductSignal {

    private final AliasStore aliasStore;
    private final AliasMatcher aliasMatcher;

    public AliasSignal(AliasStore aliasStore, AliasMatcher aliasMatcher) {
        this.aliasStore = aliasStore;
        this.aliasMatcher = aliasMatcher;
    }

    @Override
    public SignalType type() {
        return SignalType.ALIAS;
    }

    @Override
    public double score(QueryContext query, Product product) {
        double best = 0.0;
        for (Alias alias : aliasStore.findByProduct(query.scope(), product.id())) {
            best = Math.max(best, aliasMatcher.score(query, alias));
        }
        return best;
    }
}
