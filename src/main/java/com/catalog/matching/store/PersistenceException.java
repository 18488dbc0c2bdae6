package com.catalog.matching.store;

/**
 * Runtime exception thrown when an alias or training write cannot be persisted.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
