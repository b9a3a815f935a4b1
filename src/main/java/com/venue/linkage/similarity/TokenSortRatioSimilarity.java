package com.venue.linkage.similarity;

import java.util.Arrays;

/**
 * Word-order invariant similarity: both strings are split on whitespace, their tokens sorted
 * and rejoined, then compared with {@link IndelSimilarity}.
 * {@code "ANCHOR THE CROWN"} and {@code "THE CROWN ANCHOR"} score 1.0.
 */
public class TokenSortRatioSimilarity implements SimilarityAlgorithm {

    private final IndelSimilarity indel = new IndelSimilarity();

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return indel.compute(sortTokens(s1), sortTokens(s2));
    }

    @Override
    public String getName() {
        return "TokenSortRatio";
    }

    static String sortTokens(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String[] tokens = trimmed.split("\\s+");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}
