package com.dcruver.notededup.similarity;

import java.util.HashSet;
import java.util.Set;

/**
 * Set overlap: |A ∩ B| / |A ∪ B|.
 */
public final class JaccardSimilarity {

    private JaccardSimilarity() {
    }

    /**
     * Jaccard index of two sets, 0 when both are empty.
     */
    public static <T> double of(Set<T> a, Set<T> b) {
        Set<T> left = a != null ? a : Set.of();
        Set<T> right = b != null ? b : Set.of();
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }

        Set<T> smaller = left.size() <= right.size() ? left : right;
        Set<T> larger = smaller == left ? right : left;

        int intersection = 0;
        for (T item : smaller) {
            if (larger.contains(item)) {
                intersection++;
            }
        }

        Set<T> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection / union.size();
    }
}
