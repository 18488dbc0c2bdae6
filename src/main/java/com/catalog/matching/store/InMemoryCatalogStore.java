package com.catalog.matching.store;

import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.Product;
import com.catalog.matching.rules.NormalizationEngine;
import com.catalog.matching.similarity.BlockingKeyStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory catalog with a blocking-key index per scope. Thread-safe via concurrent maps.
 */
public class InMemoryCatalogStore implements CatalogStore {

    private final NormalizationEngine normalizer;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final Map<CatalogScope, ScopeCatalog> catalogs = new ConcurrentHashMap<>();

    public InMemoryCatalogStore(NormalizationEngine normalizer, BlockingKeyStrategy blockingKeyStrategy) {
        this.normalizer = normalizer;
        this.blockingKeyStrategy = blockingKeyStrategy;
    }

    // ========== Catalog maintenance ==========

    public void save(CatalogScope scope, Product product) {
        ScopeCatalog catalog = catalog(scope);
        synchronized (catalog) {
            Product previous = catalog.products.put(product.id(), product);
            if (previous != null) {
                unindex(catalog, previous);
            }
            for (String key : keysFor(product)) {
                catalog.blockingIndex.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(product.id());
            }
            catalog.version.incrementAndGet();
        }
    }

    public void saveAll(CatalogScope scope, List<Product> products) {
        products.forEach(p -> save(scope, p));
    }

    public boolean remove(CatalogScope scope, String productId) {
        ScopeCatalog catalog = catalog(scope);
        synchronized (catalog) {
            Product removed = catalog.products.remove(productId);
            if (removed == null) {
                return false;
            }
            unindex(catalog, removed);
            catalog.embeddings.remove(productId);
            catalog.version.incrementAndGet();
            return true;
        }
    }

    public void saveEmbedding(CatalogScope scope, String productId, float[] embedding) {
        ScopeCatalog catalog = catalog(scope);
        catalog.embeddings.put(productId, embedding.clone());
        catalog.version.incrementAndGet();
    }

    // ========== CatalogStore ==========

    @Override
    public List<Product> findAll(CatalogScope scope) {
        List<Product> products = new ArrayList<>(catalog(scope).products.values());
        products.sort(Comparator.comparing(Product::id));
        return Collections.unmodifiableList(products);
    }

    @Override
    public Optional<Product> findById(CatalogScope scope, String productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(catalog(scope).products.get(productId));
    }

    @Override
    public Optional<Product> findBySku(CatalogScope scope, String sku) {
        if (sku == null || sku.isBlank()) {
            return Optional.empty();
        }
        String wanted = sku.trim();
        return catalog(scope).products.values().stream()
                .filter(p -> p.sku() != null && p.sku().equalsIgnoreCase(wanted))
                .min(Comparator.comparing(Product::id));
    }

    @Override
    public List<Product> findByBlockingKeys(CatalogScope scope, Set<String> blockingKeys) {
        ScopeCatalog catalog = catalog(scope);
        Set<String> ids = new LinkedHashSet<>();
        for (String key : blockingKeys) {
            Set<String> posting = catalog.blockingIndex.get(key);
            if (posting != null) {
                ids.addAll(posting);
            }
        }
        List<Product> products = new ArrayList<>(ids.size());
        for (String id : ids) {
            Product p = catalog.products.get(id);
            if (p != null) {
                products.add(p);
            }
        }
        products.sort(Comparator.comparing(Product::id));
        return products;
    }

    @Override
    public int count(CatalogScope scope) {
        return catalog(scope).products.size();
    }

    @Override
    public Optional<float[]> findEmbedding(CatalogScope scope, String productId) {
        return Optional.ofNullable(catalog(scope).embeddings.get(productId));
    }

    @Override
    public long version(CatalogScope scope) {
        return catalog(scope).version.get();
    }

    private ScopeCatalog catalog(CatalogScope scope) {
        return catalogs.computeIfAbsent(scope, s -> new ScopeCatalog());
    }

    private Set<String> keysFor(Product product) {
        Set<String> keys = new LinkedHashSet<>();
        keys.addAll(blockingKeyStrategy.generateKeys(normalizer.normalize(product.name())));
        keys.addAll(blockingKeyStrategy.generateKeys(normalizer.normalize(product.sku())));
        keys.addAll(blockingKeyStrategy.generateKeys(normalizer.normalize(product.manufacturer())));
        return keys;
    }

    private void unindex(ScopeCatalog catalog, Product product) {
        for (String key : keysFor(product)) {
            Set<String> posting = catalog.blockingIndex.get(key);
            if (posting != null) {
                posting.remove(product.id());
            }
        }
    }

    private static final class ScopeCatalog {
        final Map<String, Product> products = new ConcurrentHashMap<>();
        final Map<String, Set<String>> blockingIndex = new ConcurrentHashMap<>();
        final Map<String, float[]> embeddings = new ConcurrentHashMap<>();
        final AtomicLong version = new AtomicLong();
    }
}
