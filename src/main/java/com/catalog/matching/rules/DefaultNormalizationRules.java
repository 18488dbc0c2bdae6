package com.catalog.matching.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rule set for industrial/hardware line items: connector words, numeric dimension
 * tokens, trade abbreviations and punctuation cleanup.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getConnectorRules());
        rules.addAll(getDimensionRules());
        rules.addAll(getAbbreviationRules());
        rules.addAll(getCleanupRules());
        return new NormalizationEngine(rules);
    }

    /**
     * "w/", "w/o" and "&amp;".
     */
    public static List<NormalizationRule> getConnectorRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("without")
                        .pattern("\\bw/o\\b")
                        .replacement(" without ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("with")
                        .pattern("\\bw/")
                        .replacement(" with ")
                        .priority(11)
                        .build(),

                NormalizationRule.builder()
                        .name("ampersand")
                        .pattern("&")
                        .replacement(" and ")
                        .priority(12)
                        .build()
        );
    }

    /**
     * Numeric tokens such as 5/16-18 or 2-1/2 keep their separators; every other hyphen is a space.
     */
    public static List<NormalizationRule> getDimensionRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("numeric-slash")
                        .pattern("(\\d)\\s*/\\s*(\\d)")
                        .replacement("$1/$2")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("numeric-hyphen")
                        .pattern("(\\d)\\s*-\\s*(\\d)")
                        .replacement("$1-$2")
                        .priority(21)
                        .build(),

                NormalizationRule.builder()
                        .name("word-hyphen")
                        .pattern("(?<!\\d)-|-(?!\\d)")
                        .replacement(" ")
                        .priority(22)
                        .build()
        );
    }

    /**
     * Trade abbreviations common on purchase orders and quotes.
     */
    public static List<NormalizationRule> getAbbreviationRules() {
        return List.of(
                // multi-word forms first so "ss" never sees them
                abbreviation("stainless-st", "\\bst\\.?\\s+steel\\b", "stainless steel", 30),
                abbreviation("stainless-st-suffix", "\\bstainless\\s+st\\b\\.?", "stainless steel", 30),
                abbreviation("zinc-pl", "\\bzinc\\s+pl\\b\\.?", "zinc plated", 30),

                abbreviation("ss", "\\bss\\b", "stainless steel", 40),
                abbreviation("zp", "\\bzp\\b", "zinc plated", 40),
                abbreviation("hx", "\\bhx\\b", "hex", 40),
                abbreviation("hd", "\\bhd\\b", "head", 40),
                abbreviation("scr", "\\bscr\\b", "screw", 40),
                abbreviation("alum", "\\balum\\b", "aluminum", 40),
                abbreviation("gr", "\\bgr\\b", "grade", 40),
                abbreviation("blk", "\\bblk\\b", "black", 40),
                abbreviation("wht", "\\bwht\\b", "white", 40),
                abbreviation("ft", "\\bft\\b", "feet", 40)
        );
    }

    public static List<NormalizationRule> getCleanupRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("strip-symbols")
                        .pattern("[^a-z0-9\\s./-]")
                        .replacement(" ")
                        .priority(90)
                        .build(),

                // a period survives only as a decimal point
                NormalizationRule.builder()
                        .name("strip-periods")
                        .pattern("(?<!\\d)\\.|\\.(?!\\d)")
                        .replacement(" ")
                        .priority(91)
                        .build(),

                NormalizationRule.builder()
                        .name("strip-slashes")
                        .pattern("(?<!\\d)/|/(?!\\d)")
                        .replacement(" ")
                        .priority(92)
                        .build()
        );
    }

    private static NormalizationRule abbreviation(String name, String pattern, String expansion, int priority) {
        return NormalizationRule.builder()
                .name("abbrev-" + name)
                .pattern(pattern)
                .replacement(expansion)
                .priority(priority)
                .build();
    }
}
