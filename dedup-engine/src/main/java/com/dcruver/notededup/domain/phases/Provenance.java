package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.domain.AnalyzedNote;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for carrying input-note provenance through merges.
 */
final class Provenance {

    static final Comparator<AnalyzedNote> CHRONOLOGICAL = Comparator.comparingInt(AnalyzedNote::getSequenceIndex);

    private Provenance() {
    }

    /**
     * Union of the members' source ids, earliest member first.
     */
    static List<String> union(Collection<AnalyzedNote> members) {
        List<AnalyzedNote> ordered = new ArrayList<>(members);
        ordered.sort(CHRONOLOGICAL);

        Set<String> ids = new LinkedHashSet<>();
        for (AnalyzedNote member : ordered) {
            List<String> sources = member.getNote().getSourceNoteIds();
            if (sources == null || sources.isEmpty()) {
                ids.add(member.getId());
            } else {
                ids.addAll(sources);
            }
        }
        return List.copyOf(ids);
    }

    static int earliestSequenceIndex(Collection<AnalyzedNote> members) {
        return members.stream()
            .mapToInt(AnalyzedNote::getSequenceIndex)
            .min()
            .orElseThrow();
    }

    /**
     * The representative re-stamped with the group's earliest position and combined provenance.
     */
    static AnalyzedNote absorb(AnalyzedNote representative, Collection<AnalyzedNote> members) {
        return representative.withNote(representative.getNote()
            .withSequenceIndex(earliestSequenceIndex(members))
            .withSourceNoteIds(union(members)));
    }

    static List<AnalyzedNote> chronological(Collection<AnalyzedNote> notes) {
        List<AnalyzedNote> ordered = new ArrayList<>(notes);
        ordered.sort(CHRONOLOGICAL);
        return ordered;
    }
}
