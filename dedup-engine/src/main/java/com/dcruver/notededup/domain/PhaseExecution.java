package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of executing a single phase.
 */
@Data
@Builder
public class PhaseExecution {
    private final String phaseName;
    private final boolean success;
    private final boolean skipped;
    private final String message;
    private final Duration elapsed;
}
