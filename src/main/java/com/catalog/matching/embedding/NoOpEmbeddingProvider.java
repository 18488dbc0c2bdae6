package com.catalog.matching.embedding;

/**
 * Provider used when no embedding service is configured. The vector signal scores 0.
 */
public class NoOpEmbeddingProvider implements EmbeddingProvider {

    @Override
    public float[] embed(String text) {
        throw new EmbeddingException("No embedding provider configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
