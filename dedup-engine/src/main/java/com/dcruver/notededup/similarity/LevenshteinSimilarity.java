package com.dcruver.notededup.similarity;

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Character-level edit distance and the similarity derived from it.
 */
public final class LevenshteinSimilarity {

    private LevenshteinSimilarity() {
    }

    /**
     * 1 - distance / max(len(a), len(b)), clamped to [0, 1]. Two empty strings are identical.
     */
    public static double of(String a, String b) {
        String left = a != null ? a : "";
        String right = b != null ? b : "";
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        double similarity = 1.0 - (double) distance(left, right) / longest;
        return Math.min(1.0, Math.max(0.0, similarity));
    }

    /**
     * Minimum number of single-character insertions, deletions or substitutions.
     * Null is treated as the empty string.
     */
    public static int distance(String a, String b) {
        return LevenshteinDistance.getDefaultInstance().apply(
            a != null ? a : "",
            b != null ? b : "");
    }
}
