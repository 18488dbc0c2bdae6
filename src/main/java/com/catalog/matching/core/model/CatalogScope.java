package com.catalog.matching.core.model;

/**
 * Tenant scope every catalog, alias and training lookup is restricted to.
 * Passed explicitly through each call instead of living in process-wide state.
 */
public record CatalogScope(String tenantId) {

    public static final String DEFAULT_TENANT = "default";

    public CatalogScope {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        tenantId = tenantId.trim();
    }

    public static CatalogScope of(String tenantId) {
        return new CatalogScope(tenantId);
    }

    public static CatalogScope defaultScope() {
        return new CatalogScope(DEFAULT_TENANT);
    }

    @Override
    public String toString() {
        return tenantId;
    }
}
