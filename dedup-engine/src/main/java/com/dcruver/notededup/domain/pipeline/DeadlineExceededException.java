package com.dcruver.notededup.domain.pipeline;

import lombok.Getter;

import java.time.Duration;

/**
 * Thrown cooperatively by phases once the pipeline deadline has passed.
 */
@Getter
public class DeadlineExceededException extends RuntimeException {

    private final String where;
    private final Duration budget;

    public DeadlineExceededException(String where, Duration budget) {
        super(String.format("Deadline of %d ms exceeded during %s", budget.toMillis(), where));
        this.where = where;
        this.budget = budget;
    }
}
