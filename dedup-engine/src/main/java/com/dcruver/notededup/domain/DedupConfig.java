package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Immutable dedup configuration, constructed once and threaded through every phase.
 * Rejects invalid values at construction with {@link InvalidConfigurationException}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DedupConfig {

    private final SimilarityWeights weights;
    private final double thresholdNear;
    private final double thresholdSentence;

    // Complementary band [min, max)
    private final double complementaryMin;
    private final double complementaryMax;

    private final boolean preserveChronology;
    private final boolean mergeComplementary;

    // Zero means no deadline
    private final Duration timeout;

    private final int minSentenceWords;

    @Builder(toBuilder = true)
    private DedupConfig(
        SimilarityWeights weights,
        double thresholdNear,
        double thresholdSentence,
        double complementaryMin,
        double complementaryMax,
        boolean preserveChronology,
        boolean mergeComplementary,
        Duration timeout,
        int minSentenceWords
    ) {
        if (weights == null) {
            throw new InvalidConfigurationException("Similarity weights are required");
        }
        requireUnit("thresholdNear", thresholdNear);
        requireUnit("thresholdSentence", thresholdSentence);
        requireUnit("complementaryMin", complementaryMin);
        requireUnit("complementaryMax", complementaryMax);
        if (complementaryMin > complementaryMax) {
            throw new InvalidConfigurationException(String.format(
                "Complementary range is empty: min %.3f > max %.3f", complementaryMin, complementaryMax));
        }
        if (minSentenceWords < 0) {
            throw new InvalidConfigurationException("minSentenceWords must be >= 0, got " + minSentenceWords);
        }

        this.weights = weights;
        this.thresholdNear = thresholdNear;
        this.thresholdSentence = thresholdSentence;
        this.complementaryMin = complementaryMin;
        this.complementaryMax = complementaryMax;
        this.preserveChronology = preserveChronology;
        this.mergeComplementary = mergeComplementary;
        this.timeout = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
        this.minSentenceWords = minSentenceWords;
    }

    /**
     * Default configuration: weights 0.4/0.2/0.4, thresholds 0.85, complementary band [0.30, 0.60).
     */
    public static DedupConfig defaults() {
        return DedupConfig.builder()
            .weights(SimilarityWeights.defaults())
            .thresholdNear(0.85)
            .thresholdSentence(0.85)
            .complementaryMin(0.30)
            .complementaryMax(0.60)
            .preserveChronology(true)
            .mergeComplementary(true)
            .timeout(Duration.ofSeconds(30))
            .minSentenceWords(3)
            .build();
    }

    public boolean hasTimeout() {
        return !timeout.isZero();
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(
                String.format("%s must be within [0, 1], got %s", name, value));
        }
    }
}
