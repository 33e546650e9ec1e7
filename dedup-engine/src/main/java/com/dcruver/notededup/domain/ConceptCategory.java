package com.dcruver.notededup.domain;

/**
 * Fixed categories of the clinical concept lexicon.
 */
public enum ConceptCategory {
    PROCEDURE,
    PATHOLOGY,
    IMAGING,
    MEDICATION,
    ANATOMY,
    FINDING,

    /**
     * Day anchors such as "pod 3" or "hd 5"
     */
    TEMPORAL;

    /**
     * Whether concepts of this category count as clinical entities for priority scoring
     */
    public boolean isEntity() {
        return this == PROCEDURE || this == PATHOLOGY || this == MEDICATION || this == FINDING;
    }
}
