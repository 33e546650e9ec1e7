package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupPhase;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.NoteAnalyzer;
import com.dcruver.notededup.domain.PhaseContext;
import com.dcruver.notededup.domain.PhaseResult;
import com.dcruver.notededup.domain.Sentence;
import com.dcruver.notededup.domain.SentenceDeduplicator;
import com.dcruver.notededup.domain.SentenceDeduplicator.Outcome;
import com.dcruver.notededup.domain.SentenceDeduplicator.SentenceMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase 3: remove sentences that repeat an earlier sentence anywhere in the corpus.
 *
 * Sentences are visited in (note sequence index, position) order, so the first chronological
 * occurrence survives. Only notes that lost a sentence are rewritten.
 *
 * Preconditions:
 * - At least one note
 *
 * Effects:
 * - Repeated sentences removed
 * - A note left without sentences is dropped; its provenance moves to the note holding the
 *   earlier copy of its first sentence
 *
 * Cost: High (O(s²) sentence comparisons)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SentenceDedupPhase implements DedupPhase {

    private final SentenceDeduplicator deduplicator;
    private final NoteAnalyzer analyzer;

    @Override
    public String getName() {
        return "SentenceDedup";
    }

    @Override
    public String getDescription() {
        return "Remove repeated sentences, keeping the earliest occurrence";
    }

    @Override
    public boolean canExecute(DedupState state, PhaseContext context) {
        return state.size() >= 1;
    }

    @Override
    public PhaseResult execute(DedupState state, PhaseContext context) {
        List<AnalyzedNote> ordered = Provenance.chronological(state.getNotes());

        List<Sentence> sentences = new ArrayList<>();
        for (AnalyzedNote note : ordered) {
            sentences.addAll(deduplicator.sentencesOf(note));
        }

        Outcome outcome = deduplicator.deduplicate(sentences, context);
        if (!outcome.hasRemovals()) {
            return PhaseResult.success(state, "No repeated sentences");
        }

        Map<String, List<Sentence>> keptByNote = new HashMap<>();
        for (Sentence sentence : outcome.kept()) {
            keptByNote.computeIfAbsent(sentence.getSourceNoteId(), key -> new ArrayList<>()).add(sentence);
        }

        // First removed sentence of each touched note decides where a dropped note's provenance goes
        Map<String, String> foldTarget = new HashMap<>();
        Set<String> touched = new HashSet<>();
        for (SentenceMatch match : outcome.removed()) {
            String noteId = match.removed().getSourceNoteId();
            touched.add(noteId);
            foldTarget.putIfAbsent(noteId, match.keptMatch().getSourceNoteId());
        }

        Map<String, AnalyzedNote> survivors = new LinkedHashMap<>();
        List<AnalyzedNote> dropped = new ArrayList<>();
        for (AnalyzedNote note : ordered) {
            if (!touched.contains(note.getId())) {
                survivors.put(note.getId(), note);
                continue;
            }
            List<Sentence> kept = keptByNote.getOrDefault(note.getId(), List.of());
            if (kept.isEmpty()) {
                log.debug("Note {} consists only of repeated sentences, dropping", note.getId());
                dropped.add(note);
                continue;
            }
            String rewritten = deduplicator.render(kept);
            survivors.put(note.getId(), analyzer.analyze(note.getNote().withRawText(rewritten)));
        }

        for (AnalyzedNote note : dropped) {
            String targetId = foldTarget.get(note.getId());
            AnalyzedNote target = survivors.get(targetId);
            if (target == null) {
                throw new IllegalStateException("No surviving owner " + targetId + " for dropped note " + note.getId());
            }
            List<String> provenance = Provenance.union(List.of(target, note));
            survivors.put(targetId, target.withNote(target.getNote().withSourceNoteIds(provenance)));
        }

        int sentencesRemoved = outcome.removed().size();
        log.info("Sentence pass removed {} sentences and {} notes", sentencesRemoved, dropped.size());

        return PhaseResult.success(
            state.withNotes(List.copyOf(survivors.values()))
                .withSentencesRemoved(state.getSentencesRemoved() + sentencesRemoved)
                .withNotesRemovedBySentenceDedup(state.getNotesRemovedBySentenceDedup() + dropped.size()),
            String.format("Removed %d sentences, dropped %d notes", sentencesRemoved, dropped.size()));
    }
}
