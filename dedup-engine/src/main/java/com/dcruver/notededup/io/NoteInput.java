package com.dcruver.notededup.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * One raw note as supplied by the caller.
 * Only {@code text} is required; role defaults to unknown and sequence index to list position.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NoteInput {
    private final String id;
    private final String text;

    // Free-text source tag, e.g. "Attending Note" or "PT consult"
    private final String sourceRole;

    private final Integer sequenceIndex;

    @JsonCreator
    public NoteInput(
            @JsonProperty("id") String id,
            @JsonProperty("text") String text,
            @JsonProperty("sourceRole") String sourceRole,
            @JsonProperty("sequenceIndex") Integer sequenceIndex) {
        this.id = id;
        this.text = text;
        this.sourceRole = sourceRole;
        this.sequenceIndex = sequenceIndex;
    }

    public static NoteInput of(String text) {
        return NoteInput.builder().text(text).build();
    }

    public static NoteInput of(String text, String sourceRole) {
        return NoteInput.builder().text(text).sourceRole(sourceRole).build();
    }
}
