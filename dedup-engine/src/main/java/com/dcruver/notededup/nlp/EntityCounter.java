package com.dcruver.notededup.nlp;

/**
 * Counts clinical entities (procedures, pathologies, medications, findings) in raw note text.
 */
public interface EntityCounter {

    int count(String text);
}
