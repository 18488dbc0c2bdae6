package com.catalog.matching.similarity;

import java.util.Set;

/**
 * Generates blocking keys from normalized text. Products sharing at least one key with the
 * query are candidates; everything else is skipped without scoring.
 */
public interface BlockingKeyStrategy {

    /**
     * @param normalizedText normalized product or query text
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String normalizedText);
}
