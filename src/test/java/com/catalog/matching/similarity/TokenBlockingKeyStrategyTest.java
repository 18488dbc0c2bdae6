package com.catalog.matching.similarity;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TokenBlockingKeyStrategyTest {

    private final TokenBlockingKeyStrategy strategy = new TokenBlockingKeyStrategy();

    @Test
    void tokenAndPrefixKeys() {
        Set<String> keys = strategy.generateKeys("safety goggles");

        assertEquals(Set.of("tok:safety", "pfx:safe", "tok:goggles", "pfx:gogg"), keys);
    }

    @Test
    void singleCharacterTokensSkipped() {
        Set<String> keys = strategy.generateKeys("x bolt");

        assertFalse(keys.contains("tok:x"));
        assertTrue(keys.contains("tok:bolt"));
        assertFalse(keys.contains("pfx:bolt"));
    }

    @Test
    void numericKeysFromDimensions() {
        Set<String> keys = strategy.generateKeys("screw 5/16-18x2");

        assertTrue(keys.contains("tok:5/16-18x2"));
        assertTrue(keys.contains("num:5"));
        assertTrue(keys.contains("num:16"));
        assertTrue(keys.contains("num:18"));
        assertTrue(keys.contains("num:2"));
        assertFalse(keys.contains("pfx:5/16"));
    }

    @Test
    void blankText() {
        assertTrue(strategy.generateKeys(null).isEmpty());
        assertTrue(strategy.generateKeys("  ").isEmpty());
    }
}
