package com.dcruver.notededup.domain;

/**
 * A temporal reference found in note text.
 *
 * @param kind  What sort of reference this is
 * @param value Normalized value (ISO date, "POD 3", or the lowercase relative phrase)
 */
public record TemporalMarker(Kind kind, String value) {

    public enum Kind {
        /**
         * Calendar date, e.g. 3/14/2024
         */
        DATE,

        /**
         * Post-operative day, e.g. POD#3
         */
        POD,

        /**
         * Relative phrase, e.g. "yesterday", "2 days ago"
         */
        RELATIVE
    }

    /**
     * Dates and PODs pin a note to a specific day; relative phrases do not.
     */
    public boolean isExplicit() {
        return kind == Kind.DATE || kind == Kind.POD;
    }
}
