package com.catalog.matching.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Blocking on words and word prefixes:
 * <ul>
 *   <li><b>Token keys</b>: every word of two or more characters (e.g. {@code tok:hex})</li>
 *   <li><b>Prefix keys</b>: first 4 characters of longer words, tolerating suffix typos
 *       (e.g. {@code pfx:gogg})</li>
 *   <li><b>Numeric keys</b>: digit runs inside dimension tokens (e.g. {@code num:16})</li>
 * </ul>
 */
public class TokenBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int PREFIX_LENGTH = 4;

    @Override
    public Set<String> generateKeys(String normalizedText) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedText == null || normalizedText.isBlank()) {
            return keys;
        }

        for (String token : normalizedText.trim().split("\\s+")) {
            if (token.length() >= 2) {
                keys.add("tok:" + token);
            }
            if (token.length() > PREFIX_LENGTH && Character.isLetter(token.charAt(0))) {
                keys.add("pfx:" + token.substring(0, PREFIX_LENGTH));
            }
            for (String part : token.split("[^0-9]+")) {
                if (!part.isEmpty()) {
                    keys.add("num:" + part);
                }
            }
        }
        return keys;
    }
}
