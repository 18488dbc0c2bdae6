package com.catalog.matching.retrieval;

/**
 * How wide the candidate net is cast.
 */
public enum RetrievalMode {
    /** Trigram floor only; used by the algorithmic tier. */
    STRICT,
    /** Lower floor on trigram or edit-distance similarity; used by the fallback tier. */
    RELAXED
}
