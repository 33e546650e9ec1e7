package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.List;

/**
 * State threaded between pipeline phases.
 * Immutable via Lombok @With; a failed phase leaves the previous state untouched.
 */
@Data
@Builder
@With
public class DedupState {
    private final List<AnalyzedNote> notes;

    // Null until the near-duplicate phase has run
    private final List<NoteCluster> clusters;

    // Removal counters
    private final int exactDuplicatesRemoved;
    private final int nearDuplicatesRemoved;
    private final int sentencesRemoved;
    private final int notesRemovedBySentenceDedup;
    private final int complementaryMerges;

    public static DedupState initial(List<AnalyzedNote> notes) {
        return DedupState.builder()
            .notes(List.copyOf(notes))
            .build();
    }

    public int size() {
        return notes.size();
    }

    public boolean isClustered() {
        return clusters != null;
    }
}
