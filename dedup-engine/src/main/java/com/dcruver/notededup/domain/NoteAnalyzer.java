package com.dcruver.notededup.domain;

import com.dcruver.notededup.nlp.TextNormalizer;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Derives normalized text, fingerprint, temporal markers and priority for a note.
 * Phases call it again whenever they produce a note with new text.
 */
@RequiredArgsConstructor
public class NoteAnalyzer {

    private final TextNormalizer normalizer;
    private final PriorityScorer priorityScorer;

    public AnalyzedNote analyze(Note note) {
        NormalizedText text = normalizer.normalize(note.getRawText());
        List<TemporalMarker> markers = priorityScorer.extractMarkers(note.getRawText());

        return AnalyzedNote.builder()
            .note(note)
            .text(text)
            .temporalMarkers(List.copyOf(markers))
            .priority(priorityScorer.score(note, markers))
            .fingerprint(Fingerprint.of(text))
            .build();
    }

    public TextNormalizer getNormalizer() {
        return normalizer;
    }
}
