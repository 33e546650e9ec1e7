package com.dcruver.notededup.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Authoring source of a clinical note.
 * Resolved once at ingestion and never re-inferred downstream.
 */
public enum SourceRole {
    /**
     * Attending physician note (staff)
     */
    ATTENDING("attending", 20),

    /**
     * Resident, intern or fellow note
     */
    RESIDENT("resident", 0),

    /**
     * Specialty consultation
     */
    CONSULTANT("consultant", 30),

    /**
     * Physical / occupational therapy note
     */
    PT_OT("pt_ot", 0),

    /**
     * Operative or procedure note
     */
    OPERATIVE("operative", 15),

    /**
     * Unknown or untagged
     */
    UNKNOWN("unknown", 0);

    private final String tag;
    private final int bonus;

    SourceRole(String tag, int bonus) {
        this.tag = tag;
        this.bonus = bonus;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Priority bonus for notes written by this source.
     */
    public int getBonus() {
        return bonus;
    }
}
