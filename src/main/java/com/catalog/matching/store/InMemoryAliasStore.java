package com.catalog.matching.store;

import com.catalog.matching.core.model.Alias;
import com.catalog.matching.core.model.CatalogScope;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory alias store keyed by (scope, normalized name, product id).
 */
public class InMemoryAliasStore implements AliasStore {

    private final Map<CatalogScope, Map<AliasKey, Alias>> aliases = new ConcurrentHashMap<>();
    private final Map<CatalogScope, AtomicLong> versions = new ConcurrentHashMap<>();

    @Override
    public List<Alias> findAll(CatalogScope scope) {
        List<Alias> all = new ArrayList<>(scoped(scope).values());
        all.sort(Comparator.comparing(Alias::getNormalizedName).thenComparing(Alias::getProductId));
        return all;
    }

    @Override
    public List<Alias> findByProduct(CatalogScope scope, String productId) {
        return scoped(scope).values().stream()
                .filter(a -> a.getProductId().equals(productId))
                .sorted(Comparator.comparing(Alias::getNormalizedName))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Alias> find(CatalogScope scope, String normalizedName, String productId) {
        return Optional.ofNullable(scoped(scope).get(new AliasKey(normalizedName, productId)));
    }

    @Override
    public Alias upsert(Alias alias) {
        scoped(alias.getScope()).put(new AliasKey(alias.getNormalizedName(), alias.getProductId()), alias);
        versions.computeIfAbsent(alias.getScope(), s -> new AtomicLong()).incrementAndGet();
        return alias;
    }

    @Override
    public long version(CatalogScope scope) {
        AtomicLong v = versions.get(scope);
        return v != null ? v.get() : 0L;
    }

    private Map<AliasKey, Alias> scoped(CatalogScope scope) {
        return aliases.computeIfAbsent(scope, s -> new ConcurrentHashMap<>());
    }

    private record AliasKey(String normalizedName, String productId) {}
}
