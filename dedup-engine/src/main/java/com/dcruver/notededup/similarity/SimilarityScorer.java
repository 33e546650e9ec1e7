package com.dcruver.notededup.similarity;

import com.dcruver.notededup.domain.Concept;
import com.dcruver.notededup.domain.NormalizedText;
import com.dcruver.notededup.domain.SimilarityScore;
import com.dcruver.notededup.domain.SimilarityWeights;
import com.dcruver.notededup.nlp.ConceptExtractor;
import com.dcruver.notededup.nlp.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * Scores two normalized texts on word overlap, edit distance and concept overlap.
 * Symmetric in its arguments and never throws.
 */
@Slf4j
@RequiredArgsConstructor
public class SimilarityScorer {

    private static final SimilarityScore IDENTICAL = SimilarityScore.builder()
        .jaccard(1.0)
        .levenshtein(1.0)
        .semantic(1.0)
        .combined(1.0)
        .build();

    private final ConceptExtractor conceptExtractor;
    private final TextNormalizer normalizer;

    /**
     * Score two raw strings, normalizing both first.
     */
    public SimilarityScore score(String a, String b, SimilarityWeights weights) {
        // Raw identity holds even when normalization leaves nothing, as with punctuation or a bare title
        if (a != null && !a.isEmpty() && a.equals(b)) {
            return IDENTICAL;
        }
        return score(normalizer.normalize(a), normalizer.normalize(b), weights);
    }

    public SimilarityScore score(NormalizedText a, NormalizedText b, SimilarityWeights weights) {
        NormalizedText left = a != null ? a : NormalizedText.EMPTY;
        NormalizedText right = b != null ? b : NormalizedText.EMPTY;
        SimilarityWeights w = weights != null ? weights : SimilarityWeights.defaults();

        // Identical non-empty text is a perfect match even without lexicon hits
        if (!left.isEmpty() && left.getLowercase().equals(right.getLowercase())) {
            return IDENTICAL;
        }

        double jaccard = clamp(JaccardSimilarity.of(left.wordSet(), right.wordSet()));
        double levenshtein = clamp(LevenshteinSimilarity.of(left.canonical(), right.canonical()));
        double semantic = clamp(SemanticSimilarity.of(concepts(left), concepts(right)));

        return SimilarityScore.builder()
            .jaccard(jaccard)
            .levenshtein(levenshtein)
            .semantic(semantic)
            .combined(clamp(w.combine(jaccard, levenshtein, semantic)))
            .build();
    }

    private Set<Concept> concepts(NormalizedText text) {
        try {
            Set<Concept> concepts = conceptExtractor.extract(text);
            return concepts != null ? concepts : Set.of();
        } catch (RuntimeException e) {
            log.warn("Concept extraction failed, scoring without concepts: {}", e.getMessage());
            return Set.of();
        }
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }
}
