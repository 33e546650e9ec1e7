package com.dcruver.notededup.domain.phases;

import com.dcruver.notededup.EngineFixture;
import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.PhaseResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SentenceDedupPhaseTest {

    private final EngineFixture engine = new EngineFixture();
    private final SentenceDedupPhase phase = engine.sentencePhase;

    @Test
    void testRepeatedSentenceRemovedFromLaterNote() {
        AnalyzedNote first = engine.analyze("n0",
            "Patient developed vasospasm on POD 3. Started nimodipine for vasospasm prophylaxis.", 0);
        AnalyzedNote second = engine.analyze("n1",
            "Patient developed vasospasm on POD 3. Plan repeat CTA tomorrow.", 1);

        DedupState state = phase.execute(EngineFixture.state(first, second), EngineFixture.context())
            .getResultingState();

        assertEquals(2, state.size());
        assertEquals(1, state.getSentencesRemoved());
        assertSame(first, state.getNotes().get(0));

        AnalyzedNote rewritten = state.getNotes().get(1);
        assertEquals("n1", rewritten.getId());
        assertEquals("Plan repeat CTA tomorrow.", rewritten.getNote().getRawText());
        assertEquals(List.of("Plan repeat CTA tomorrow."), rewritten.getText().getSentences());
        assertTrue(rewritten.getScore() < second.getScore(), "Rewritten note is re-scored");
    }

    @Test
    void testNoteOfOnlyRepeatsIsDroppedIntoEarlierOwner() {
        AnalyzedNote first = engine.analyze("n0",
            "Patient developed vasospasm on POD 3. Started nimodipine for vasospasm prophylaxis.", 0);
        AnalyzedNote second = engine.analyze("n1",
            "Patient developed vasospasm on POD 3. Plan repeat CTA tomorrow.", 1);
        AnalyzedNote repeat = engine.analyze("n2", "Patient developed vasospasm on POD 3.", 2);

        DedupState state = phase.execute(EngineFixture.state(first, second, repeat), EngineFixture.context())
            .getResultingState();

        assertEquals(List.of("n0", "n1"), state.getNotes().stream().map(AnalyzedNote::getId).toList());
        assertEquals(2, state.getSentencesRemoved());
        assertEquals(1, state.getNotesRemovedBySentenceDedup());
        assertEquals(List.of("n0", "n2"), state.getNotes().get(0).getNote().getSourceNoteIds());
        assertEquals(first.getNote().getRawText(), state.getNotes().get(0).getNote().getRawText());
    }

    @Test
    void testEarliestOccurrenceWinsRegardlessOfListOrder() {
        AnalyzedNote later = engine.analyze("later", "Neuro exam unchanged from prior. Family updated at bedside.", 4);
        AnalyzedNote earlier = engine.analyze("earlier", "Family updated at bedside.", 1);

        DedupState state = phase.execute(EngineFixture.state(later, earlier), EngineFixture.context())
            .getResultingState();

        AnalyzedNote rewritten = state.getNotes().stream()
            .filter(note -> note.getId().equals("later"))
            .findFirst()
            .orElseThrow();
        assertEquals("Neuro exam unchanged from prior.", rewritten.getNote().getRawText());
    }

    @Test
    void testNoRepeatsLeavesStateUnchanged() {
        DedupState input = EngineFixture.state(
            engine.analyze("a", "No fever. Tolerating diet.", 0),
            engine.analyze("b", "No fevers. Ambulating in hallway.", 1));

        PhaseResult result = phase.execute(input, EngineFixture.context());

        assertTrue(result.isSuccess());
        assertSame(input, result.getResultingState());
    }
}
