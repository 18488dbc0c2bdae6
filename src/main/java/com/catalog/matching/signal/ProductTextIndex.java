package com.catalog.matching.signal;

import com.catalog.matching.core.model.Product;
import com.catalog.matching.rules.NormalizationEngine;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.ArrayList;
import java.util.List;

/**
 * Memoizes normalized product fields. Keyed by the product value itself, so an edited
 * product simply misses and is normalized again.
 */
public class ProductTextIndex {

    private static final int DEFAULT_MAX_SIZE = 100_000;

    private final NormalizationEngine normalizer;
    private final Cache<Product, ProductTexts> cache;

    public ProductTextIndex(NormalizationEngine normalizer) {
        this(normalizer, DEFAULT_MAX_SIZE);
    }

    public ProductTextIndex(NormalizationEngine normalizer, int maxSize) {
        this.normalizer = normalizer;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .build();
    }

    public ProductTexts texts(Product product) {
        return cache.get(product, p -> new ProductTexts(
                normalizer.normalize(p.name()),
                normalizer.normalize(p.sku()),
                normalizer.normalize(p.manufacturer())));
    }

    public NormalizationEngine normalizer() {
        return normalizer;
    }

    /**
     * Normalized name, SKU and manufacturer; absent fields are empty strings.
     */
    public record ProductTexts(String name, String sku, String manufacturer) {

        /**
         * The non-empty fields, name first.
         */
        public List<String> fields() {
            List<String> fields = new ArrayList<>(3);
            if (!name.isEmpty()) {
                fields.add(name);
            }
            if (!sku.isEmpty()) {
                fields.add(sku);
            }
            if (!manufacturer.isEmpty()) {
                fields.add(manufacturer);
            }
            return fields;
        }
    }
}
