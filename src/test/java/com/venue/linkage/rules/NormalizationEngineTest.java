package com.venue.linkage.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should order rules by priority")
    void testRuleOrdering() {
        int previous = Integer.MIN_VALUE;
        for (NormalizationRule rule : engine.getRules()) {
            assertTrue(rule.getPriority() >= previous);
            previous = rule.getPriority();
        }
    }

    @Test
    @DisplayName("Should apply custom rules in priority order")
    void testCustomRule() {
        engine.addRule(NormalizationRule.builder()
                .name("saint")
                .pattern("\\bST\\b")
                .replacement("SAINT")
                .priority(150)
                .build());

        assertEquals("SAINT JOHN", engine.normalize("St. John"));
    }

    @Test
    @DisplayName("Should remove rules by name")
    void testRemoveRule() {
        assertTrue(engine.removeRule("suffix-ltd"));
        assertFalse(engine.removeRule("suffix-ltd"));

        assertEquals("CROWN LTD", engine.normalize("Crown Ltd"));
    }

    @Test
    @DisplayName("Should check equivalence after normalization")
    void testAreEquivalent() {
        assertTrue(engine.areEquivalent("The Crown & Anchor LTD", "THE CROWN AND ANCHOR"));
        assertFalse(engine.areEquivalent("Red Lion", "Red Lyon"));
    }

    @Test
    @DisplayName("An engine without rules only upper-cases and collapses whitespace")
    void testEmptyEngine() {
        NormalizationEngine bare = new NormalizationEngine();
        assertEquals("A & B", bare.normalize("  a   &  b "));
    }

    @Test
    @DisplayName("Rules should be case-insensitive unless told otherwise")
    void testCaseSensitivity() {
        NormalizationRule insensitive = NormalizationRule.builder()
                .name("drop-bar")
                .pattern("bar")
                .replacement("")
                .build();
        NormalizationRule sensitive = NormalizationRule.builder()
                .name("drop-bar")
                .pattern("bar")
                .replacement("")
                .caseInsensitive(false)
                .build();

        assertEquals("FOO", insensitive.apply("FOOBAR"));
        assertEquals("FOOBAR", sensitive.apply("FOOBAR"));
    }
}
