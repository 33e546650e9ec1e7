package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.DedupPhase;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.NoteCluster;
import com.dcruver.notededup.domain.PhaseContext;
import com.dcruver.notededup.domain.PhaseResult;
import com.dcruver.notededup.domain.SimilarityScore;
import com.dcruver.notededup.similarity.SimilarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Phase 2: cluster near-duplicate notes and keep one representative per cluster.
 *
 * Notes are visited in ascending sequence index. Each unassigned note seeds a cluster and
 * pulls in every later unassigned note scoring at least thresholdNear against it. A note that
 * has joined a cluster is never compared again. On a repeat pass new clusters are folded into
 * the ones already recorded.
 *
 * Representative: highest priority, then longer normalized text, then lowest sequence index.
 *
 * Preconditions:
 * - At least two notes
 *
 * Effects:
 * - One note per cluster; clusters recorded on the state
 *
 * Cost: High (O(n²) similarity comparisons)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NearDuplicateClusterPhase implements DedupPhase {

    static final Comparator<AnalyzedNote> REPRESENTATIVE_ORDER = Comparator
        .comparingDouble(AnalyzedNote::getScore).reversed()
        .thenComparing(Comparator.comparingInt((AnalyzedNote note) -> note.getText().getLowercase().length()).reversed())
        .thenComparingInt(AnalyzedNote::getSequenceIndex);

    private final SimilarityScorer scorer;

    @Override
    public String getName() {
        return "NearDuplicates";
    }

    @Override
    public String getDescription() {
        return "Cluster near-duplicate notes and keep the highest-priority representative";
    }

    @Override
    public boolean canExecute(DedupState state, PhaseContext context) {
        return state.size() >= 2;
    }

    @Override
    public PhaseResult execute(DedupState state, PhaseContext context) {
        DedupConfig config = context.getConfig();
        List<AnalyzedNote> ordered = Provenance.chronological(state.getNotes());
        boolean[] assigned = new boolean[ordered.size()];

        List<NoteCluster> clusters = new ArrayList<>();
        List<List<AnalyzedNote>> groups = new ArrayList<>();
        List<AnalyzedNote> survivors = new ArrayList<>();

        for (int i = 0; i < ordered.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            AnalyzedNote seed = ordered.get(i);
            assigned[i] = true;

            List<AnalyzedNote> members = new ArrayList<>();
            members.add(seed);
            double minSimilarity = 1.0;

            for (int j = i + 1; j < ordered.size(); j++) {
                if (assigned[j]) {
                    continue;
                }
                context.checkDeadline(getName());

                AnalyzedNote candidate = ordered.get(j);
                SimilarityScore score = scorer.score(seed.getText(), candidate.getText(), config.getWeights());
                if (score.isAtLeast(config.getThresholdNear())) {
                    log.debug("Note {} joins cluster of {} (combined {})",
                        candidate.getId(), seed.getId(), String.format("%.3f", score.getCombined()));
                    members.add(candidate);
                    assigned[j] = true;
                    minSimilarity = Math.min(minSimilarity, score.getCombined());
                }
            }

            AnalyzedNote representative = members.stream().min(REPRESENTATIVE_ORDER).orElseThrow();
            Set<String> memberIds = new LinkedHashSet<>();
            members.forEach(member -> memberIds.add(member.getId()));

            clusters.add(NoteCluster.builder()
                .representativeNoteId(representative.getId())
                .memberNoteIds(memberIds)
                .minSimilarity(minSimilarity)
                .build());
            groups.add(members);
            survivors.add(members.size() == 1 ? seed : Provenance.absorb(representative, members));
        }

        if (state.isClustered()) {
            clusters = foldInto(state.getClusters(), clusters, groups);
        }

        int removed = state.size() - survivors.size();
        log.info("Near-duplicate pass formed {} clusters from {} notes ({} removed)",
            clusters.size(), state.size(), removed);

        return PhaseResult.success(
            state.withNotes(List.copyOf(survivors))
                .withClusters(List.copyOf(clusters))
                .withNearDuplicatesRemoved(state.getNearDuplicatesRemoved() + removed),
            String.format("Formed %d clusters, removed %d near duplicates", clusters.size(), removed));
    }

    /**
     * Merge clusters formed on a repeat pass into those from earlier passes.
     * A member stands for every earlier cluster whose representative it is or has absorbed.
     */
    static List<NoteCluster> foldInto(List<NoteCluster> previous, List<NoteCluster> formed,
                                      List<List<AnalyzedNote>> groups) {
        List<NoteCluster> result = new ArrayList<>(previous);
        for (int k = 0; k < formed.size(); k++) {
            NoteCluster cluster = formed.get(k);
            if (cluster.isSingleton()) {
                continue;
            }

            Set<String> memberIds = new LinkedHashSet<>();
            double minSimilarity = cluster.getMinSimilarity();
            int insertAt = result.size();
            for (AnalyzedNote member : groups.get(k)) {
                Set<String> covered = new HashSet<>(member.getNote().getSourceNoteIds() != null
                    ? member.getNote().getSourceNoteIds() : List.of());
                covered.add(member.getId());

                boolean matched = false;
                Iterator<NoteCluster> earlier = result.iterator();
                for (int index = 0; earlier.hasNext(); index++) {
                    NoteCluster candidate = earlier.next();
                    if (covered.contains(candidate.getRepresentativeNoteId())) {
                        memberIds.addAll(candidate.getMemberNoteIds());
                        minSimilarity = Math.min(minSimilarity, candidate.getMinSimilarity());
                        insertAt = Math.min(insertAt, index);
                        earlier.remove();
                        index--;
                        matched = true;
                    }
                }
                if (!matched) {
                    memberIds.add(member.getId());
                }
            }

            result.add(Math.min(insertAt, result.size()), NoteCluster.builder()
                .representativeNoteId(cluster.getRepresentativeNoteId())
                .memberNoteIds(memberIds)
                .minSimilarity(minSimilarity)
                .build());
        }
        return result;
    }
}
