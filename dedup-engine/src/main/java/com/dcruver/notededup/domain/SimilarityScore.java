package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

/**
 * The three similarity signals between two text spans plus their weighted combination.
 * All values are in [0, 1].
 */
@Data
@Builder
public class SimilarityScore {
    private final double jaccard;
    private final double levenshtein;
    private final double semantic;
    private final double combined;

    public boolean isAtLeast(double threshold) {
        return combined >= threshold;
    }

    /**
     * Check if combined score falls in [min, max)
     */
    public boolean isWithin(double min, double max) {
        return combined >= min && combined < max;
    }
}
