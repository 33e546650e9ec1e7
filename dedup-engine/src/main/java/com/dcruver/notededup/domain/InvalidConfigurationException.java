package com.dcruver.notededup.domain;

/**
 * Raised when dedup configuration is rejected at construction.
 * Fatal to construction only, never to a pipeline run.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
