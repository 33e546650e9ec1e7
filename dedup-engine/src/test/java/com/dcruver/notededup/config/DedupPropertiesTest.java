package com.dcruver.notededup.config;

import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.InvalidConfigurationException;
import com.dcruver.notededup.domain.PriorityScorer;
import com.dcruver.notededup.domain.phases.ComplementaryMergePhase;
import com.dcruver.notededup.domain.phases.ExactDuplicatePhase;
import com.dcruver.notededup.domain.phases.NearDuplicateClusterPhase;
import com.dcruver.notededup.domain.phases.SentenceDedupPhase;
import com.dcruver.notededup.domain.pipeline.DedupPipeline;
import com.dcruver.notededup.nlp.SourceRoleClassifier;
import com.dcruver.notededup.nlp.TextNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binding of {@code dedup.*} properties and wiring of the engine beans.
 */
class DedupPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(EngineTestConfiguration.class);

    @Test
    void testDefaultsMatchDomainDefaults() {
        assertEquals(DedupConfig.defaults(), new DedupProperties().toConfig());
    }

    @Test
    void testContextWiresPipelineInOrder() {
        runner.run(context -> {
            assertNull(context.getStartupFailure());

            DedupPipeline pipeline = context.getBean(DedupPipeline.class);
            assertEquals(List.of("ExactDuplicates", "NearDuplicates", "SentenceDedup", "ComplementaryMerge"),
                pipeline.getPhases().stream().map(phase -> phase.getName()).toList());
            assertEquals(DedupConfig.defaults(), pipeline.getConfig());
            assertNotNull(context.getBean(PriorityScorer.class));
        });
    }

    @Test
    void testPropertiesOverrideDefaults() {
        runner.withPropertyValues(
                "dedup.weights.jaccard=0.5",
                "dedup.weights.levenshtein=0.1",
                "dedup.weights.semantic=0.4",
                "dedup.threshold-near=0.9",
                "dedup.merge-complementary=false",
                "dedup.timeout=0")
            .run(context -> {
                DedupConfig config = context.getBean(DedupConfig.class);
                assertEquals(0.5, config.getWeights().jaccard());
                assertEquals(0.9, config.getThresholdNear());
                assertFalse(config.isMergeComplementary());
                assertEquals(Duration.ZERO, config.getTimeout());
                assertFalse(config.hasTimeout());
            });
    }

    @Test
    void testInvalidWeightsFailStartup() {
        runner.withPropertyValues("dedup.weights.jaccard=0.9")
            .run(context -> {
                Throwable failure = context.getStartupFailure();
                assertNotNull(failure);

                Throwable cause = failure;
                while (cause != null && !(cause instanceof InvalidConfigurationException)) {
                    cause = cause.getCause();
                }
                assertNotNull(cause, "Expected InvalidConfigurationException in " + failure);
                assertTrue(cause.getMessage().contains("sum to 1.0"));
            });
    }

    @Test
    void testMissingLexiconFailsStartup() {
        runner.withPropertyValues("dedup.lexicon=lexicon/does-not-exist.json")
            .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Configuration
    @EnableConfigurationProperties(DedupProperties.class)
    @Import({
        EngineConfiguration.class,
        TextNormalizer.class,
        SourceRoleClassifier.class,
        ExactDuplicatePhase.class,
        NearDuplicateClusterPhase.class,
        SentenceDedupPhase.class,
        ComplementaryMergePhase.class
    })
    static class EngineTestConfiguration {
    }
}
