package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.DedupPhase;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.Note;
import com.dcruver.notededup.domain.NoteAnalyzer;
import com.dcruver.notededup.domain.PhaseContext;
import com.dcruver.notededup.domain.PhaseResult;
import com.dcruver.notededup.domain.Sentence;
import com.dcruver.notededup.domain.SentenceDeduplicator;
import com.dcruver.notededup.domain.SentenceDeduplicator.Outcome;
import com.dcruver.notededup.domain.SimilarityScore;
import com.dcruver.notededup.domain.TemporalContextMatcher;
import com.dcruver.notededup.similarity.SimilarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase 4: merge notes that overlap partially and describe the same point in time.
 *
 * A pair qualifies when its combined similarity lies in [complementaryMin, complementaryMax)
 * and the notes share temporal context. The merged note is the union of both notes' sentences
 * with sentence deduplication re-applied. Passes repeat until nothing merges.
 *
 * Preconditions:
 * - mergeComplementary enabled
 * - At least two notes
 *
 * Effects:
 * - Qualifying pairs replaced by one merged note with id "a+b"
 *
 * Cost: High (repeated O(n²) comparisons)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ComplementaryMergePhase implements DedupPhase {

    private final SimilarityScorer scorer;
    private final SentenceDeduplicator deduplicator;
    private final NoteAnalyzer analyzer;
    private final TemporalContextMatcher temporalContextMatcher;

    @Override
    public String getName() {
        return "ComplementaryMerge";
    }

    @Override
    public String getDescription() {
        return "Merge temporally linked notes with complementary content";
    }

    @Override
    public boolean canExecute(DedupState state, PhaseContext context) {
        return context.getConfig().isMergeComplementary() && state.size() >= 2;
    }

    @Override
    public PhaseResult execute(DedupState state, PhaseContext context) {
        DedupConfig config = context.getConfig();
        List<AnalyzedNote> notes = Provenance.chronological(state.getNotes());
        int merges = 0;
        int sentencesRemoved = 0;

        boolean merged;
        do {
            merged = false;
            search:
            for (int i = 0; i < notes.size(); i++) {
                for (int j = i + 1; j < notes.size(); j++) {
                    context.checkDeadline(getName());

                    AnalyzedNote first = notes.get(i);
                    AnalyzedNote second = notes.get(j);
                    SimilarityScore score = scorer.score(first.getText(), second.getText(), config.getWeights());
                    if (!score.isWithin(config.getComplementaryMin(), config.getComplementaryMax())) {
                        continue;
                    }
                    if (!temporalContextMatcher.sameContext(first, second, j == i + 1)) {
                        log.debug("Notes {} and {} are complementary ({}) but not in the same temporal context",
                            first.getId(), second.getId(), String.format("%.3f", score.getCombined()));
                        continue;
                    }

                    MergeOutcome outcome = merge(first, second, context);
                    log.debug("Merged {} and {} (combined {}) into {}",
                        first.getId(), second.getId(), String.format("%.3f", score.getCombined()), outcome.note().getId());
                    notes.set(i, outcome.note());
                    notes.remove(j);
                    merges++;
                    sentencesRemoved += outcome.sentencesRemoved();
                    merged = true;
                    break search;
                }
            }
        } while (merged);

        log.info("Complementary pass performed {} merges", merges);

        return PhaseResult.success(
            state.withNotes(List.copyOf(notes))
                .withComplementaryMerges(state.getComplementaryMerges() + merges)
                .withSentencesRemoved(state.getSentencesRemoved() + sentencesRemoved),
            String.format("Performed %d complementary merges", merges));
    }

    private MergeOutcome merge(AnalyzedNote first, AnalyzedNote second, PhaseContext context) {
        List<Sentence> union = new ArrayList<>(deduplicator.sentencesOf(first));
        union.addAll(deduplicator.sentencesOf(second));
        Outcome outcome = deduplicator.deduplicate(union, context);

        AnalyzedNote dominant = second.getScore() > first.getScore() ? second : first;
        Note mergedNote = Note.builder()
            .id(first.getId() + "+" + second.getId())
            .rawText(deduplicator.render(outcome.kept()))
            .sourceRole(dominant.getNote().getSourceRole())
            .sequenceIndex(Math.min(first.getSequenceIndex(), second.getSequenceIndex()))
            .sourceNoteIds(Provenance.union(List.of(first, second)))
            .build();

        return new MergeOutcome(analyzer.analyze(mergedNote), outcome.removed().size());
    }

    private record MergeOutcome(AnalyzedNote note, int sentencesRemoved) {
    }
}
