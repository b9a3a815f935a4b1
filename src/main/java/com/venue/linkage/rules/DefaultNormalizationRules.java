package com.venue.linkage.rules;

import java.util.List;

/**
 * Built-in rules for food-service venue names.
 *
 * <p>Legal suffixes are stripped only after punctuation has been removed and spaces collapsed,
 * so that {@code "Crown Ltd."} and {@code "Crown Ltd Ltd"} both normalize in a single pass.</p>
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getSymbolRules());
        engine.addRules(getCharacterRules());
        engine.addRules(getLegalSuffixRules());
        return engine;
    }

    /**
     * Symbol abbreviations expanded to words.
     */
    public static List<NormalizationRule> getSymbolRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("symbol-ampersand")
                        .pattern("&")
                        .replacement(" AND ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("symbol-plus")
                        .pattern("\\s\\+\\s")
                        .replacement(" AND ")
                        .priority(10)
                        .build()
        );
    }

    /**
     * Restricts the output alphabet to {@code [A-Z0-9 ]}.
     */
    public static List<NormalizationRule> getCharacterRules() {
        return List.of(
                // Tabs and newlines become plain spaces before the alphabet filter drops them
                NormalizationRule.builder()
                        .name("common-whitespace")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(50)
                        .build(),

                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^A-Z0-9 ]+")
                        .replacement("")
                        .caseInsensitive(false)
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern(" {2,}")
                        .replacement(" ")
                        .priority(200)
                        .build(),

                NormalizationRule.builder()
                        .name("common-trim")
                        .pattern("^ +| +$")
                        .replacement("")
                        .priority(210)
                        .build()
        );
    }

    /**
     * Trailing legal-entity suffixes, removed only when they terminate the name.
     */
    public static List<NormalizationRule> getLegalSuffixRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("suffix-ltd")
                        .pattern("(?: (?:LTD|LIMITED))+$")
                        .replacement("")
                        .caseInsensitive(false)
                        .priority(300)
                        .build()
        );
    }
}
