package com.catalog.matching.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Source of text embeddings for the vector signal. Vectors are opaque to the matcher:
 * it only compares them by cosine similarity.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a single text.
     *
     * @throws EmbeddingException if the provider cannot produce a vector
     */
    float[] embed(String text);

    /**
     * Embeds several texts, preserving order.
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    String getProviderName();

    /**
     * False when the provider is not configured; the vector signal is then skipped.
     */
    boolean isAvailable();
}
