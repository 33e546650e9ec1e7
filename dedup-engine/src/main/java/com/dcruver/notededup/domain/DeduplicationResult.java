package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Output of one pipeline run: surviving and merged notes plus statistics.
 * Every note traces back to at least one input note through its sourceNoteIds.
 */
@Data
@Builder
public class DeduplicationResult {
    private final List<Note> notes;
    private final int inputCount;
    private final int outputCount;
    private final double reductionPercent;
    private final int clusterCount;
    private final List<NoteCluster> clusters;
    private final PhaseStats phaseStats;

    // True when the run hit its deadline and returned the last completed phase's output
    private final boolean partial;

    /**
     * Compute reduction percentage, 0 for empty input.
     */
    public static double reductionPercent(int inputCount, int outputCount) {
        if (inputCount <= 0) {
            return 0.0;
        }
        double percent = (inputCount - outputCount) * 100.0 / inputCount;
        return Math.min(100.0, Math.max(0.0, percent));
    }
}
