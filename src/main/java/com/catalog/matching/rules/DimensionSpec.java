package com.catalog.matching.rules;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Thread and length specifications pulled out of a line item, e.g. "5/16-18" and "x2-1/2".
 * Two texts that share one of these almost always describe the same part size.
 *
 * @param thread thread spec (diameter/pitch-length form), or null
 * @param length length spec prefixed with "x", or null
 */
public record DimensionSpec(String thread, String length) {

    private static final Pattern THREAD = Pattern.compile("\\d+/\\d+-\\d+");
    private static final Pattern LENGTH = Pattern.compile("x\\s*\\d+[/-]?\\d*", Pattern.CASE_INSENSITIVE);

    public static DimensionSpec extract(String text) {
        if (text == null || text.isBlank()) {
            return new DimensionSpec(null, null);
        }
        return new DimensionSpec(find(THREAD, text), find(LENGTH, text));
    }

    public Optional<String> threadSpec() {
        return Optional.ofNullable(thread);
    }

    public Optional<String> lengthSpec() {
        return Optional.ofNullable(length);
    }

    public boolean sameThread(DimensionSpec other) {
        return thread != null && other != null && thread.equals(other.thread);
    }

    public boolean sameLength(DimensionSpec other) {
        return length != null && other != null && length.equals(other.length);
    }

    private static String find(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        return m.group().replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
