package com.dcruver.notededup.domain;

/**
 * An unexpected exception raised inside a pipeline phase.
 * The phase was passed through with its unmodified input.
 */
public record PhaseFailure(String phase, String exceptionType, String message) {

    public static PhaseFailure of(String phase, Throwable error) {
        return new PhaseFailure(phase, error.getClass().getSimpleName(), error.getMessage());
    }
}
