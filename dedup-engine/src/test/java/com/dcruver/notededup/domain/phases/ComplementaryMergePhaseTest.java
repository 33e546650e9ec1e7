package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.EngineFixture;
import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.Note;
import com.dcruver.notededup.domain.PhaseContext;
import com.dcruver.notededup.domain.SourceRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplementaryMergePhaseTest {

    private final EngineFixture engine = new EngineFixture();
    private final ComplementaryMergePhase phase = engine.mergePhase;

    // Any pair counts as complementary, so only the temporal gate decides
    private final PhaseContext wideBand = EngineFixture.context(DedupConfig.defaults().toBuilder()
        .complementaryMin(0.0)
        .complementaryMax(1.0)
        .build());

    @Test
    void testSameDayNotesMergeKeepingBothSentences() {
        AnalyzedNote first = engine.analyze("n0", "POD 3: patient afebrile, tolerating diet.", SourceRole.ATTENDING, 0);
        AnalyzedNote second = engine.analyze("n1", "POD 3: ambulating with PT, wound clean.", 1);

        DedupState state = phase.execute(EngineFixture.state(first, second), EngineFixture.context())
            .getResultingState();

        assertEquals(1, state.size());
        assertEquals(1, state.getComplementaryMerges());
        assertEquals(0, state.getSentencesRemoved());

        Note merged = state.getNotes().get(0).getNote();
        assertEquals("n0+n1", merged.getId());
        assertEquals("POD 3: patient afebrile, tolerating diet.\nPOD 3: ambulating with PT, wound clean.",
            merged.getRawText());
        assertEquals(SourceRole.ATTENDING, merged.getSourceRole());
        assertEquals(0, merged.getSequenceIndex());
        assertEquals(List.of("n0", "n1"), merged.getSourceNoteIds());
    }

    @Test
    void testUnrelatedNotesAreNotMerged() {
        AnalyzedNote first = engine.analyze("n0", "Aspirin 81 mg daily started for DVT prophylaxis.", 0);
        AnalyzedNote second = engine.analyze("n1", "MRI brain showed no acute infarct.", 1);

        DedupState state = phase.execute(EngineFixture.state(first, second), EngineFixture.context())
            .getResultingState();

        assertEquals(List.of(first, second), state.getNotes());
        assertEquals(0, state.getComplementaryMerges());
    }

    @Test
    void testDifferentDatesBlockMerge() {
        AnalyzedNote first = engine.analyze("n0", "03/14/2024 Aspirin 81 mg daily started.", 0);
        AnalyzedNote second = engine.analyze("n1", "03/16/2024 MRI brain showed no acute infarct.", 1);

        DedupState state = phase.execute(EngineFixture.state(first, second), wideBand).getResultingState();

        assertEquals(2, state.size());
    }

    @Test
    void testSameDateAllowsMerge() {
        AnalyzedNote first = engine.analyze("n0", "03/14/2024 Aspirin 81 mg daily started.", 0);
        AnalyzedNote second = engine.analyze("n1", "03/14/2024 MRI brain showed no acute infarct.", 1);

        DedupState state = phase.execute(EngineFixture.state(first, second), wideBand).getResultingState();

        assertEquals(1, state.size());
        assertEquals("n0+n1", state.getNotes().get(0).getId());
    }

    @Test
    void testMergesRepeatUntilStable() {
        AnalyzedNote a = engine.analyze("a", "POD 3: patient afebrile.", 0);
        AnalyzedNote b = engine.analyze("b", "POD 3: ambulating in hallway.", 1);
        AnalyzedNote c = engine.analyze("c", "POD 3: wound clean and dry.", 2);

        DedupState state = phase.execute(EngineFixture.state(a, b, c), wideBand).getResultingState();

        assertEquals(1, state.size());
        assertEquals(2, state.getComplementaryMerges());
        Note merged = state.getNotes().get(0).getNote();
        assertEquals("a+b+c", merged.getId());
        assertEquals(List.of("a", "b", "c"), merged.getSourceNoteIds());
        assertEquals("POD 3: patient afebrile.\nPOD 3: ambulating in hallway.\nPOD 3: wound clean and dry.",
            merged.getRawText());
    }

    @Test
    void testDisabledByConfiguration() {
        DedupState state = EngineFixture.state(
            engine.analyze("n0", "POD 3: patient afebrile, tolerating diet.", 0),
            engine.analyze("n1", "POD 3: ambulating with PT, wound clean.", 1));
        PhaseContext disabled = EngineFixture.context(DedupConfig.defaults().toBuilder()
            .mergeComplementary(false)
            .build());

        assertFalse(phase.canExecute(state, disabled));
        assertTrue(phase.canExecute(state, EngineFixture.context()));
    }
}
