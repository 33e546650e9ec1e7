package com.dcruver.notededup.domain;

/**
 * One step of the deduplication pipeline. Phases only remove or merge notes; none adds content.
 */
public interface DedupPhase {

    String getName();

    String getDescription();

    /**
     * Whether the phase applies to this state under this configuration.
     */
    boolean canExecute(DedupState state, PhaseContext context);

    /**
     * Run the phase. May throw; the pipeline then passes the input state through unchanged.
     */
    PhaseResult execute(DedupState state, PhaseContext context);
}
