package com.venue.linkage.similarity;

/**
 * Ratcliff/Obershelp gestalt pattern matching: {@code 2 * M / T}, where M is the number of
 * characters in recursively found longest common blocks and T the total length of both strings.
 *
 * <p>The block search depends on argument order when several longest blocks tie,
 * so arguments are put into a canonical order first to keep the score symmetric.</p>
 */
public class SequenceMatcherSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        String a = s1;
        String b = s2;
        if (a.length() > b.length() || (a.length() == b.length() && a.compareTo(b) > 0)) {
            a = s2;
            b = s1;
        }

        int matches = matchingCharacters(a, 0, a.length(), b, 0, b.length());
        return (2.0 * matches) / (a.length() + b.length());
    }

    @Override
    public String getName() {
        return "SequenceMatcher";
    }

    private int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }

        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;

        // Longest common substring within the window; earliest block wins ties
        int[] previous = new int[bHi - bLo + 1];
        int[] current = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = j - bLo + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    current[k] = previous[k - 1] + 1;
                    if (current[k] > bestSize) {
                        bestSize = current[k];
                        bestI = i - bestSize + 1;
                        bestJ = j - bestSize + 1;
                    }
                } else {
                    current[k] = 0;
                }
            }
            int[] temp = previous;
            previous = current;
            current = temp;
        }

        if (bestSize == 0) {
            return 0;
        }

        return bestSize
                + matchingCharacters(a, aLo, bestI, b, bLo, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
}
