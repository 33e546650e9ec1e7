package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Statistics accumulated over one pipeline run.
 */
@Data
@Builder
public class PhaseStats {
    private final List<PhaseExecution> executions;

    // Removals per phase
    private final int exactDuplicatesRemoved;
    private final int nearDuplicatesRemoved;
    private final int sentencesRemoved;
    private final int notesRemovedBySentenceDedup;
    private final int complementaryMerges;

    private final List<PhaseFailure> errors;
    private final List<InputError> warnings;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public int getTotalNotesRemoved() {
        return exactDuplicatesRemoved + nearDuplicatesRemoved + notesRemovedBySentenceDedup + complementaryMerges;
    }
}
