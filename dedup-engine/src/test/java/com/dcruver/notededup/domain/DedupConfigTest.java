package com.dcruver.notededup.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DedupConfigTest {

    @Test
    void testDefaults() {
        DedupConfig config = DedupConfig.defaults();

        assertEquals(SimilarityWeights.defaults(), config.getWeights());
        assertEquals(0.85, config.getThresholdNear());
        assertEquals(0.85, config.getThresholdSentence());
        assertEquals(0.30, config.getComplementaryMin());
        assertEquals(0.60, config.getComplementaryMax());
        assertTrue(config.isPreserveChronology());
        assertTrue(config.isMergeComplementary());
        assertEquals(Duration.ofSeconds(30), config.getTimeout());
        assertEquals(3, config.getMinSentenceWords());
    }

    @Test
    void testWeightsMustSumToOne() {
        InvalidConfigurationException error = assertThrows(InvalidConfigurationException.class,
            () -> new SimilarityWeights(0.5, 0.2, 0.4));
        assertTrue(error.getMessage().contains("sum to 1.0"));

        // Within tolerance
        assertDoesNotThrow(() -> new SimilarityWeights(0.4, 0.2, 0.4005));
    }

    @Test
    void testNonFiniteWeightRejected() {
        InvalidConfigurationException error = assertThrows(InvalidConfigurationException.class,
            () -> new SimilarityWeights(Double.NaN, 0.5, 0.5));
        assertTrue(error.getMessage().contains("finite"));

        assertThrows(InvalidConfigurationException.class,
            () -> new SimilarityWeights(0.5, Double.POSITIVE_INFINITY, 0.5));
        assertThrows(InvalidConfigurationException.class,
            () -> DedupConfig.defaults().toBuilder().weights(new SimilarityWeights(0.4, 0.2, Double.NaN)).build());
    }

    @Test
    void testNegativeWeightRejected() {
        assertThrows(InvalidConfigurationException.class, () -> new SimilarityWeights(1.2, -0.2, 0.0));
    }

    @Test
    void testThresholdsMustBeInUnitRange() {
        assertThrows(InvalidConfigurationException.class,
            () -> DedupConfig.defaults().toBuilder().thresholdNear(1.2).build());
        assertThrows(InvalidConfigurationException.class,
            () -> DedupConfig.defaults().toBuilder().thresholdSentence(-0.1).build());
        assertThrows(InvalidConfigurationException.class,
            () -> DedupConfig.defaults().toBuilder().complementaryMax(Double.NaN).build());
    }

    @Test
    void testComplementaryRangeMustNotBeInverted() {
        assertThrows(InvalidConfigurationException.class,
            () -> DedupConfig.defaults().toBuilder().complementaryMin(0.7).complementaryMax(0.5).build());
    }

    @Test
    void testMissingWeightsRejected() {
        assertThrows(InvalidConfigurationException.class,
            () -> DedupConfig.defaults().toBuilder().weights(null).build());
    }

    @Test
    void testZeroOrNegativeTimeoutMeansNone() {
        assertFalse(DedupConfig.defaults().toBuilder().timeout(Duration.ZERO).build().hasTimeout());
        assertFalse(DedupConfig.defaults().toBuilder().timeout(Duration.ofSeconds(-1)).build().hasTimeout());
        assertFalse(DedupConfig.defaults().toBuilder().timeout(null).build().hasTimeout());
        assertTrue(DedupConfig.defaults().hasTimeout());
    }

    @Test
    void testConfigErrorIsIllegalArgument() {
        assertInstanceOf(IllegalArgumentException.class, new InvalidConfigurationException("bad"));
    }
}
