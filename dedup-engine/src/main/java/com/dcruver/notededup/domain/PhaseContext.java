package com.dcruver.notededup.domain;

import com.dcruver.notededup.domain.pipeline.Deadline;
import lombok.Builder;
import lombok.Data;

/**
 * Per-run inputs shared by all phases: the configuration and the time budget.
 */
@Data
@Builder
public class PhaseContext {
    private final DedupConfig config;
    private final Deadline deadline;

    public void checkDeadline(String where) {
        if (deadline != null) {
            deadline.check(where);
        }
    }
}
