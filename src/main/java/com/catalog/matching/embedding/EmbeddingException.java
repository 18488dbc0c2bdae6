package com.catalog.matching.embedding;

/**
 * Raised when an embedding request fails or returns an unusable payload.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
