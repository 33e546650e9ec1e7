package com.dcruver.notededup.domain;

/**
 * Weights for combining the three similarity signals.
 *
 * @param jaccard     Weight for word-set overlap (0.0-1.0)
 * @param levenshtein Weight for normalized edit distance (0.0-1.0)
 * @param semantic    Weight for concept-category overlap (0.0-1.0)
 */
public record SimilarityWeights(double jaccard, double levenshtein, double semantic) {

    public static final double SUM_TOLERANCE = 0.001;

    /**
     * Validate weights are finite, non-negative and sum to 1.0.
     */
    public SimilarityWeights {
        if (!Double.isFinite(jaccard) || !Double.isFinite(levenshtein) || !Double.isFinite(semantic)) {
            throw new InvalidConfigurationException(String.format(
                "Similarity weights must be finite, got jaccard=%s levenshtein=%s semantic=%s",
                jaccard, levenshtein, semantic));
        }
        if (jaccard < 0 || levenshtein < 0 || semantic < 0) {
            throw new InvalidConfigurationException(String.format(
                "Similarity weights must be non-negative, got jaccard=%.3f levenshtein=%.3f semantic=%.3f",
                jaccard, levenshtein, semantic));
        }
        double sum = jaccard + levenshtein + semantic;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidConfigurationException(
                String.format("Similarity weights must sum to 1.0, got %.3f", sum));
        }
    }

    /**
     * Default weights: 0.4 word overlap, 0.2 edit distance, 0.4 concepts.
     */
    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.4, 0.2, 0.4);
    }

    /**
     * Calculate combined score from individual signals.
     */
    public double combine(double jaccardScore, double levenshteinScore, double semanticScore) {
        return (jaccard * jaccardScore)
            + (levenshtein * levenshteinScore)
            + (semantic * semanticScore);
    }
}
