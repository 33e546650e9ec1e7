package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.List;

/**
 * A clinical note fragment describing part of a patient episode.
 * Immutable via Lombok @With; phases produce new instances instead of mutating.
 */
@Data
@Builder
@With
public class Note {
    private final String id;
    private final String rawText;
    private final SourceRole sourceRole;

    // Upload / chronological order, tie-break of last resort
    private final int sequenceIndex;

    // Ids of the input notes this note was built from (provenance)
    private final List<String> sourceNoteIds;

    /**
     * Create a freshly ingested note whose provenance is itself
     */
    public static Note ingested(String id, String rawText, SourceRole role, int sequenceIndex) {
        return Note.builder()
            .id(id)
            .rawText(rawText)
            .sourceRole(role != null ? role : SourceRole.UNKNOWN)
            .sequenceIndex(sequenceIndex)
            .sourceNoteIds(List.of(id))
            .build();
    }
}
