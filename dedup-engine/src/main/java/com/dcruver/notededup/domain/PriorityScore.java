package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

/**
 * Authority / information-density score of a note, with its breakdown.
 */
@Data
@Builder
public class PriorityScore {
    private final String noteId;
    private final double score;

    // Breakdown
    private final double lengthComponent;
    private final int entityCount;
    private final int temporalMarkerCount;
    private final int roleBonus;
    private final int operativeMentions;
}
