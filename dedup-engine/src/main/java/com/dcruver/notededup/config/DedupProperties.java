package com.dcruver.notededup.config;

import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.SimilarityWeights;
import com.dcruver.notededup.nlp.ConceptLexicon;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Dedup settings bound from {@code dedup.*}.
 * Weights must sum to 1.0; validated when converted to {@link DedupConfig}.
 */
@ConfigurationProperties(prefix = "dedup")
@Data
public class DedupProperties {
    private Weights weights = new Weights();

    private double thresholdNear = 0.85;
    private double thresholdSentence = 0.85;
    private double complementaryMin = 0.30;
    private double complementaryMax = 0.60;

    private boolean preserveChronology = true;
    private boolean mergeComplementary = true;

    // Zero disables the deadline
    private Duration timeout = Duration.ofSeconds(30);

    private int minSentenceWords = 3;

    private String lexicon = ConceptLexicon.DEFAULT_RESOURCE;

    @Data
    public static class Weights {
        private double jaccard = 0.4;
        private double levenshtein = 0.2;
        private double semantic = 0.4;
    }

    /**
     * Build the immutable configuration threaded through the pipeline.
     *
     * @throws com.dcruver.notededup.domain.InvalidConfigurationException if any value is out of range
     */
    public DedupConfig toConfig() {
        return DedupConfig.builder()
            .weights(new SimilarityWeights(weights.getJaccard(), weights.getLevenshtein(), weights.getSemantic()))
            .thresholdNear(thresholdNear)
            .thresholdSentence(thresholdSentence)
            .complementaryMin(complementaryMin)
            .complementaryMax(complementaryMax)
            .preserveChronology(preserveChronology)
            .mergeComplementary(mergeComplementary)
            .timeout(timeout)
            .minSentenceWords(minSentenceWords)
            .build();
    }
}
