package com.catalog.matching.core.model;

import java.util.Objects;

/**
 * Catalog product as seen by the matcher. Read-only: the engine never creates or edits products.
 */
public record Product(
        String id,
        String sku,
        String name,
        String manufacturer,
        String category
) {
    public Product {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
    }

    public static Product of(String id, String sku, String name) {
        return new Product(id, sku, name, null, null);
    }
}
