package com.catalog.matching.store;

/**
 * Thrown when the catalog cannot be read at all. The one failure a match query does not
 * degrade around: without a catalog there is nothing to rank.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
