package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

/**
 * A sentence extracted for sentence-level deduplication.
 * Owned by exactly one note.
 */
@Data
@Builder
public class Sentence {
    private final String sourceNoteId;
    private final int sourceSequenceIndex;
    private final int position;
    private final String text;
    private final NormalizedText normalized;
}
