package com.dcruver.notededup.domain.pipeline;

import com.dcruver.notededup.domain.InputError;
import com.dcruver.notededup.domain.Note;
import com.dcruver.notededup.domain.SourceRole;
import com.dcruver.notededup.io.NoteInput;
import com.dcruver.notededup.nlp.SourceRoleClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns caller inputs into immutable {@link Note}s.
 * Null or text-less inputs are skipped with an {@link InputError}; nothing here is fatal.
 */
@Slf4j
@RequiredArgsConstructor
public class NoteIngestor {

    private final SourceRoleClassifier roleClassifier;

    public IngestionResult ingest(List<NoteInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return new IngestionResult(List.of(), List.of());
        }

        List<Note> notes = new ArrayList<>();
        List<InputError> warnings = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (int index = 0; index < inputs.size(); index++) {
            NoteInput input = inputs.get(index);
            if (input == null) {
                skip(warnings, index, "null note");
                continue;
            }
            if (input.getText() == null) {
                skip(warnings, index, "missing or non-text 'text'");
                continue;
            }
            if (input.getText().isBlank()) {
                skip(warnings, index, "empty text");
                continue;
            }

            String id = input.getId() != null && !input.getId().isBlank() ? input.getId().trim() : "note-" + index;
            if (!seenIds.add(id)) {
                String renamed = id + "#" + index;
                log.warn("Duplicate note id '{}' at index {}, renamed to '{}'", id, index, renamed);
                warnings.add(new InputError(index, "duplicate id '" + id + "' renamed to '" + renamed + "'"));
                id = renamed;
                seenIds.add(id);
            }

            SourceRole role = roleClassifier.classify(input.getSourceRole());
            int sequenceIndex = input.getSequenceIndex() != null ? input.getSequenceIndex() : index;
            notes.add(Note.ingested(id, input.getText(), role, sequenceIndex));
        }

        return new IngestionResult(List.copyOf(notes), List.copyOf(warnings));
    }

    private static void skip(List<InputError> warnings, int index, String reason) {
        log.warn("Skipping input {}: {}", index, reason);
        warnings.add(new InputError(index, reason));
    }

    /**
     * Ingested notes in input order plus the inputs that were skipped or adjusted.
     */
    public record IngestionResult(List<Note> notes, List<InputError> warnings) {
    }
}
