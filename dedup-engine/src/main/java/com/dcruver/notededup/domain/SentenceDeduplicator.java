package com.dcruver.notededup.domain;

import com.dcruver.notededup.nlp.TextNormalizer;
import com.dcruver.notededup.similarity.SimilarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes sentences that repeat an earlier sentence.
 * The earliest occurrence always survives; surviving sentences are never reordered.
 */
@Slf4j
@RequiredArgsConstructor
public class SentenceDeduplicator {

    private final SimilarityScorer scorer;
    private final TextNormalizer normalizer;

    /**
     * Sentences of a note, tagged with the note's id and sequence index.
     */
    public List<Sentence> sentencesOf(AnalyzedNote note) {
        List<String> texts = note.getText().getSentences();
        List<Sentence> sentences = new ArrayList<>(texts.size());
        for (int position = 0; position < texts.size(); position++) {
            String text = texts.get(position);
            sentences.add(Sentence.builder()
                .sourceNoteId(note.getId())
                .sourceSequenceIndex(note.getSequenceIndex())
                .position(position)
                .text(text)
                .normalized(normalizer.normalize(text))
                .build());
        }
        return sentences;
    }

    /**
     * Deduplicate sentences given in chronological order.
     */
    public Outcome deduplicate(List<Sentence> sentences, PhaseContext context) {
        DedupConfig config = context.getConfig();
        List<Sentence> kept = new ArrayList<>();
        List<SentenceMatch> removed = new ArrayList<>();

        for (Sentence candidate : sentences) {
            context.checkDeadline("sentence deduplication");

            Sentence match = findEarlierDuplicate(candidate, kept, config);
            if (match == null) {
                kept.add(candidate);
            } else {
                log.debug("Dropping sentence {}#{} repeating {}#{}: '{}'",
                    candidate.getSourceNoteId(), candidate.getPosition(),
                    match.getSourceNoteId(), match.getPosition(), candidate.getText());
                removed.add(new SentenceMatch(candidate, match));
            }
        }
        return new Outcome(kept, removed);
    }

    /**
     * Join sentences back into note text, one per line so re-splitting gives the same sentences.
     */
    public String render(List<Sentence> sentences) {
        List<String> lines = new ArrayList<>(sentences.size());
        for (Sentence sentence : sentences) {
            lines.add(sentence.getText());
        }
        return String.join("\n", lines);
    }

    private Sentence findEarlierDuplicate(Sentence candidate, List<Sentence> kept, DedupConfig config) {
        NormalizedText text = candidate.getNormalized();
        // Sentences without content words carry no comparable signal
        if (text.getWords().isEmpty()) {
            return null;
        }
        String canonical = text.canonical();
        boolean fuzzyEligible = text.getWords().size() >= config.getMinSentenceWords();

        for (Sentence earlier : kept) {
            NormalizedText other = earlier.getNormalized();
            if (other.getWords().isEmpty()) {
                continue;
            }
            if (canonical.equals(other.canonical())) {
                return earlier;
            }
            if (fuzzyEligible && other.getWords().size() >= config.getMinSentenceWords()) {
                SimilarityScore score = scorer.score(text, other, config.getWeights());
                if (score.isAtLeast(config.getThresholdSentence())) {
                    return earlier;
                }
            }
        }
        return null;
    }

    /**
     * A removed sentence and the earlier kept sentence it repeats.
     */
    public record SentenceMatch(Sentence removed, Sentence keptMatch) {
    }

    public record Outcome(List<Sentence> kept, List<SentenceMatch> removed) {

        public boolean hasRemovals() {
            return !removed.isEmpty();
        }
    }
}
