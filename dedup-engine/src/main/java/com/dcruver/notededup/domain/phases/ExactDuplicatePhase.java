package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupPhase;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.Fingerprint;
import com.dcruver.notededup.domain.PhaseContext;
import com.dcruver.notededup.domain.PhaseResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Phase 1: collapse notes whose normalized text is byte-identical.
 *
 * Groups by SHA-256 fingerprint and keeps the highest-priority member of each group
 * (ties: lowest sequence index).
 *
 * Preconditions:
 * - At least two notes
 *
 * Effects:
 * - One note per fingerprint
 * - Survivor carries the group's earliest sequence index and all members' provenance
 *
 * Cost: Low (single hashing pass)
 */
@Component
@Slf4j
public class ExactDuplicatePhase implements DedupPhase {

    static final Comparator<AnalyzedNote> REPRESENTATIVE_ORDER = Comparator
        .comparingDouble(AnalyzedNote::getScore).reversed()
        .thenComparingInt(AnalyzedNote::getSequenceIndex);

    @Override
    public String getName() {
        return "ExactDuplicates";
    }

    @Override
    public String getDescription() {
        return "Remove byte-identical notes after normalization";
    }

    @Override
    public boolean canExecute(DedupState state, PhaseContext context) {
        return state.size() >= 2;
    }

    @Override
    public PhaseResult execute(DedupState state, PhaseContext context) {
        Map<Fingerprint, List<AnalyzedNote>> groups = new LinkedHashMap<>();
        for (AnalyzedNote note : Provenance.chronological(state.getNotes())) {
            groups.computeIfAbsent(note.getFingerprint(), key -> new ArrayList<>()).add(note);
        }

        List<AnalyzedNote> survivors = new ArrayList<>(groups.size());
        for (Map.Entry<Fingerprint, List<AnalyzedNote>> group : groups.entrySet()) {
            List<AnalyzedNote> members = group.getValue();
            if (members.size() == 1) {
                survivors.add(members.get(0));
                continue;
            }

            AnalyzedNote representative = members.stream().min(REPRESENTATIVE_ORDER).orElseThrow();
            log.debug("Fingerprint {} shared by {} notes, keeping {}",
                group.getKey().shortHex(), members.size(), representative.getId());
            survivors.add(Provenance.absorb(representative, members));
        }

        int removed = state.size() - survivors.size();
        log.info("Exact-duplicate pass removed {} of {} notes", removed, state.size());

        return PhaseResult.success(
            state.withNotes(List.copyOf(survivors))
                .withExactDuplicatesRemoved(state.getExactDuplicatesRemoved() + removed),
            String.format("Removed %d exact duplicates", removed));
    }
}
