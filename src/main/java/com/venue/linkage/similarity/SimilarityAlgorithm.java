package com.venue.linkage.similarity;

/**
 * String similarity between two normalized venue names.
 * Implementations must be symmetric and return 1.0 for identical strings
 * and 0.0 for completely dissimilar ones.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
