package com.dcruver.notededup.io;

import com.dcruver.notededup.EngineFixture;
import com.dcruver.notededup.domain.DeduplicationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DedupResultWriterTest {

    @TempDir
    Path tempDir;

    private final DedupResultWriter writer = new DedupResultWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    private DeduplicationResult scenarioResult() {
        return new EngineFixture().pipeline().run(List.of(
            new NoteInput("n0", "Patient developed vasospasm on POD 3.", null, null),
            new NoteInput("n1", "Pt developed vasospasm POD#3.", "attending", null)));
    }

    @Test
    void testJsonShape() throws IOException {
        JsonNode json = mapper.readTree(writer.toJson(scenarioResult()));

        assertEquals(2, json.get("inputCount").asInt());
        assertEquals(1, json.get("outputCount").asInt());
        assertEquals(50.0, json.get("reductionPercent").asDouble());
        assertFalse(json.get("partial").asBoolean());

        JsonNode note = json.get("notes").get(0);
        assertEquals("n1", note.get("id").asText());
        assertEquals("attending", note.get("sourceRole").asText());
        assertEquals("n0", note.get("sourceNoteIds").get(0).asText());

        JsonNode execution = json.get("phaseStats").get("executions").get(0);
        assertEquals("ExactDuplicates", execution.get("phaseName").asText());
        assertTrue(execution.get("elapsed").asText().startsWith("PT"), "Durations are ISO-8601");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path file = tempDir.resolve("out/nested/result.json");

        writer.write(scenarioResult(), file);

        assertTrue(Files.exists(file));
        assertEquals(1, mapper.readTree(file.toFile()).get("clusterCount").asInt());
    }
}
