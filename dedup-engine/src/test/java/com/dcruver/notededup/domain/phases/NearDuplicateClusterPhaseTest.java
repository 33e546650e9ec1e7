package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.EngineFixture;
import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.NoteCluster;
import com.dcruver.notededup.domain.PriorityScore;
import com.dcruver.notededup.domain.SourceRole;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class NearDuplicateClusterPhaseTest {

    private final EngineFixture engine = new EngineFixture();
    private final NearDuplicateClusterPhase phase = engine.nearPhase;

    private static AnalyzedNote withScore(AnalyzedNote note, double score) {
        return note.withPriority(PriorityScore.builder().noteId(note.getId()).score(score).build());
    }

    @Test
    void testAbbreviationVariantsClusterUnderTaggedNote() {
        AnalyzedNote untagged = engine.analyze("n0", "Patient developed vasospasm on POD 3.", 0);
        AnalyzedNote attending = engine.analyze("n1", "Pt developed vasospasm POD#3.", SourceRole.ATTENDING, 1);

        DedupState state = phase.execute(EngineFixture.state(untagged, attending), EngineFixture.context())
            .getResultingState();

        assertEquals(1, state.size());
        assertEquals(1, state.getNearDuplicatesRemoved());

        AnalyzedNote survivor = state.getNotes().get(0);
        assertEquals("n1", survivor.getId());
        assertEquals("Pt developed vasospasm POD#3.", survivor.getNote().getRawText());
        assertEquals(0, survivor.getSequenceIndex());
        assertEquals(List.of("n0", "n1"), survivor.getNote().getSourceNoteIds());

        assertTrue(state.isClustered());
        NoteCluster cluster = state.getClusters().get(0);
        assertEquals("n1", cluster.getRepresentativeNoteId());
        assertEquals(Set.of("n0", "n1"), cluster.getMemberNoteIds());
        assertTrue(cluster.getMinSimilarity() >= 0.85);
    }

    @Test
    void testUnrelatedNotesFormSingletonClusters() {
        AnalyzedNote a = engine.analyze("a", "Aspirin 81 mg daily started for DVT prophylaxis.", 0);
        AnalyzedNote b = engine.analyze("b", "MRI brain showed no acute infarct.", 1);

        DedupState state = phase.execute(EngineFixture.state(a, b), EngineFixture.context()).getResultingState();

        assertEquals(2, state.getClusters().size());
        assertTrue(state.getClusters().stream().allMatch(NoteCluster::isSingleton));
        assertSame(a, state.getNotes().get(0));
        assertSame(b, state.getNotes().get(1));
        assertEquals(0, state.getNearDuplicatesRemoved());
    }

    @Test
    void testSeedsVisitedInSequenceOrder() {
        AnalyzedNote later = engine.analyze("later", "MRI brain showed no acute infarct.", 5);
        AnalyzedNote earlier = engine.analyze("earlier", "Aspirin 81 mg daily started for DVT prophylaxis.", 2);

        DedupState state = phase.execute(EngineFixture.state(later, earlier), EngineFixture.context())
            .getResultingState();

        assertEquals("earlier", state.getClusters().get(0).getRepresentativeNoteId());
        assertEquals("later", state.getClusters().get(1).getRepresentativeNoteId());
    }

    @Test
    void testRepresentativeTieBreaks() {
        AnalyzedNote shortText = withScore(engine.analyze("short", "Vasospasm on POD 3.", 0), 10.0);
        AnalyzedNote longText = withScore(engine.analyze("long", "Developed vasospasm on POD 3.", 1), 10.0);
        AnalyzedNote longLater = withScore(engine.analyze("longLater", "Developed vasospasm on POD 3.", 2), 10.0);
        AnalyzedNote highScore = withScore(engine.analyze("high", "Vasospasm.", 3), 11.0);

        assertEquals("long", Stream.of(shortText, longText, longLater)
            .min(NearDuplicateClusterPhase.REPRESENTATIVE_ORDER).orElseThrow().getId());
        assertEquals("high", Stream.of(shortText, longText, longLater, highScore)
            .min(NearDuplicateClusterPhase.REPRESENTATIVE_ORDER).orElseThrow().getId());
    }

    @Test
    void testAssignedNoteLeavesComparisonPool() {
        AnalyzedNote n0 = engine.analyze("n0", "Patient developed vasospasm on POD 3.", 0);
        AnalyzedNote n1 = engine.analyze("n1", "MRI brain showed no acute infarct.", 1);
        AnalyzedNote n2 = engine.analyze("n2", "Pt developed vasospasm POD#3.", 2);

        DedupState state = phase.execute(EngineFixture.state(n0, n1, n2), EngineFixture.context())
            .getResultingState();

        assertEquals(2, state.getClusters().size());
        assertEquals(Set.of("n0", "n2"), state.getClusters().get(0).getMemberNoteIds());
        assertEquals(Set.of("n1"), state.getClusters().get(1).getMemberNoteIds());
        assertEquals(List.of("n0", "n1"), state.getNotes().stream().map(AnalyzedNote::getId).toList());
        assertEquals(List.of("n0", "n2"), state.getNotes().get(0).getNote().getSourceNoteIds());
    }

    @Test
    void testRepeatPassFoldsIntoEarlierClusters() {
        AnalyzedNote n0 = engine.analyze("n0", "Patient developed vasospasm on POD 3.", 0);
        AnalyzedNote n1 = engine.analyze("n1", "MRI brain showed no acute infarct.", 1);
        AnalyzedNote n2 = engine.analyze("n2", "Pt developed vasospasm POD#3.", 2);
        DedupState firstPass = phase.execute(EngineFixture.state(n0, n1, n2), EngineFixture.context())
            .getResultingState();

        // A note rewritten by a later phase now matches the first cluster
        AnalyzedNote n3 = engine.analyze("n3", "Pt developed vasospasm POD#3.", 3);
        List<AnalyzedNote> notes = new ArrayList<>(firstPass.getNotes());
        notes.add(n3);
        DedupState state = phase.execute(firstPass.withNotes(List.copyOf(notes)), EngineFixture.context())
            .getResultingState();

        assertEquals(2, state.size());
        assertEquals(2, state.getNearDuplicatesRemoved());
        assertEquals(2, state.getClusters().size());
        assertEquals(Set.of("n0", "n2", "n3"), state.getClusters().get(0).getMemberNoteIds());
        assertEquals(Set.of("n1"), state.getClusters().get(1).getMemberNoteIds());
    }
}
