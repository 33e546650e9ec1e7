package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * A group of near-duplicate notes collapsed to one representative.
 */
@Data
@Builder
public class NoteCluster {
    private final String representativeNoteId;

    // Insertion ordered, seed first
    private final Set<String> memberNoteIds;

    // Lowest combined similarity between the seed and any member
    private final double minSimilarity;

    public int size() {
        return memberNoteIds.size();
    }

    public boolean isSingleton() {
        return memberNoteIds.size() == 1;
    }
}
