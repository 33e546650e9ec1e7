package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a single phase execution.
 */
@Data
@Builder
public class PhaseResult {
    private final boolean success;
    private final DedupState resultingState;
    private final String message;

    public static PhaseResult success(DedupState state, String message) {
        return PhaseResult.builder()
            .success(true)
            .resultingState(state)
            .message(message)
            .build();
    }

    public static PhaseResult failure(String message) {
        return PhaseResult.builder()
            .success(false)
            .message(message)
            .build();
    }
}
