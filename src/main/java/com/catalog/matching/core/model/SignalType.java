package com.catalog.matching.core.model;

/**
 * The independent similarity signals combined by the algorithmic tier.
 */
public enum SignalType {
    VECTOR,
    TRIGRAM,
    FUZZY,
    ALIAS,
    LEARNED
}
