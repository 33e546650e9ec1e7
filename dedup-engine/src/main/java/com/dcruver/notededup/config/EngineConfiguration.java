package com.dcruver.notededup.config;

import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.NoteAnalyzer;
import com.dcruver.notededup.domain.PriorityScorer;
import com.dcruver.notededup.domain.SentenceDeduplicator;
import com.dcruver.notededup.domain.TemporalContextMatcher;
import com.dcruver.notededup.domain.phases.ComplementaryMergePhase;
import com.dcruver.notededup.domain.phases.ExactDuplicatePhase;
import com.dcruver.notededup.domain.phases.NearDuplicateClusterPhase;
import com.dcruver.notededup.domain.phases.SentenceDedupPhase;
import com.dcruver.notededup.domain.pipeline.DedupPipeline;
import com.dcruver.notededup.domain.pipeline.NoteIngestor;
import com.dcruver.notededup.nlp.ConceptExtractor;
import com.dcruver.notededup.nlp.ConceptLexicon;
import com.dcruver.notededup.nlp.EntityCounter;
import com.dcruver.notededup.nlp.KeywordEntityCounter;
import com.dcruver.notededup.nlp.LexiconConceptExtractor;
import com.dcruver.notededup.nlp.RegexTemporalMarkerExtractor;
import com.dcruver.notededup.nlp.SourceRoleClassifier;
import com.dcruver.notededup.nlp.TemporalMarkerExtractor;
import com.dcruver.notededup.nlp.TextNormalizer;
import com.dcruver.notededup.similarity.SimilarityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the dedup engine.
 *
 * The extraction collaborators (concept extractor, entity counter, temporal marker extractor)
 * back off when the host application supplies its own.
 */
@Configuration
@Slf4j
public class EngineConfiguration {

    /**
     * Validated configuration. An invalid one fails start-up.
     */
    @Bean
    public DedupConfig dedupConfig(DedupProperties properties) {
        DedupConfig config = properties.toConfig();
        log.info("Dedup config: weights {}, near {}, sentence {}, complementary [{}, {}), timeout {}",
            config.getWeights(), config.getThresholdNear(), config.getThresholdSentence(),
            config.getComplementaryMin(), config.getComplementaryMax(), config.getTimeout());
        return config;
    }

    @Bean
    public ConceptLexicon conceptLexicon(DedupProperties properties) {
        return ConceptLexicon.loadResource(properties.getLexicon());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConceptExtractor conceptExtractor(ConceptLexicon lexicon) {
        return new LexiconConceptExtractor(lexicon);
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityCounter entityCounter(TextNormalizer normalizer, ConceptExtractor conceptExtractor) {
        return new KeywordEntityCounter(normalizer, conceptExtractor);
    }

    @Bean
    @ConditionalOnMissingBean
    public TemporalMarkerExtractor temporalMarkerExtractor() {
        return new RegexTemporalMarkerExtractor();
    }

    @Bean
    public SimilarityScorer similarityScorer(ConceptExtractor conceptExtractor, TextNormalizer normalizer) {
        return new SimilarityScorer(conceptExtractor, normalizer);
    }

    @Bean
    public PriorityScorer priorityScorer(ObjectProvider<EntityCounter> entityCounter,
                                         ObjectProvider<TemporalMarkerExtractor> temporalMarkerExtractor) {
        EntityCounter counter = entityCounter.getIfAvailable();
        if (counter == null) {
            log.warn("No entity counter available - priority scores use length and role only");
        }
        return new PriorityScorer(counter, temporalMarkerExtractor.getIfAvailable());
    }

    @Bean
    public NoteAnalyzer noteAnalyzer(TextNormalizer normalizer, PriorityScorer priorityScorer) {
        return new NoteAnalyzer(normalizer, priorityScorer);
    }

    @Bean
    public SentenceDeduplicator sentenceDeduplicator(SimilarityScorer scorer, TextNormalizer normalizer) {
        return new SentenceDeduplicator(scorer, normalizer);
    }

    @Bean
    public TemporalContextMatcher temporalContextMatcher() {
        return new TemporalContextMatcher();
    }

    @Bean
    public NoteIngestor noteIngestor(SourceRoleClassifier classifier) {
        return new NoteIngestor(classifier);
    }

    /**
     * Phases run in this fixed order: exact, near, sentence, complementary.
     */
    @Bean
    public DedupPipeline dedupPipeline(
            DedupConfig config,
            NoteIngestor ingestor,
            NoteAnalyzer analyzer,
            ExactDuplicatePhase exactDuplicatePhase,
            NearDuplicateClusterPhase nearDuplicateClusterPhase,
            SentenceDedupPhase sentenceDedupPhase,
            ComplementaryMergePhase complementaryMergePhase) {
        return new DedupPipeline(config, ingestor, analyzer, List.of(
            exactDuplicatePhase,
            nearDuplicateClusterPhase,
            sentenceDedupPhase,
            complementaryMergePhase));
    }
}
