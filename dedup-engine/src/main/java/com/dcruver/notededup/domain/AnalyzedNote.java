package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A note together with everything derived from it once per pipeline run.
 */
@Data
@Builder
@With
public class AnalyzedNote {
    private final Note note;
    private final NormalizedText text;
    private final PriorityScore priority;
    private final List<TemporalMarker> temporalMarkers;
    private final Fingerprint fingerprint;

    public String getId() {
        return note.getId();
    }

    public int getSequenceIndex() {
        return note.getSequenceIndex();
    }

    public double getScore() {
        return priority != null ? priority.getScore() : 0.0;
    }

    /**
     * Distinct marker values of one kind
     */
    public Set<String> markerValues(TemporalMarker.Kind kind) {
        if (temporalMarkers == null) {
            return Set.of();
        }
        return temporalMarkers.stream()
            .filter(marker -> marker.kind() == kind)
            .map(TemporalMarker::value)
            .collect(Collectors.toSet());
    }
}
