package com.dcruver.notededup.domain;

/**
 * An input that was skipped at ingestion (null or non-text), or an id that had to be rewritten.
 *
 * @param index  Position in the input list
 * @param reason Human-readable reason
 */
public record InputError(int index, String reason) {
}
