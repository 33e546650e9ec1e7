package com.dcruver.notededup.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads note inputs from disk.
 *
 * Accepts either a JSON array of {@code {id?, text, sourceRole?, sequenceIndex?}} objects
 * (optionally wrapped as {@code {"notes": [...]}}) or plain text with notes separated by
 * lines containing only {@code ---}.
 *
 * Malformed entries are returned with a null text so ingestion can report them.
 */
@Component
@Slf4j
public class NoteInputReader {

    private static final Pattern SEPARATOR = Pattern.compile("(?m)^---\\s*$");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public List<NoteInput> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Note file does not exist: " + file);
        }
        String content = Files.readString(file);
        List<NoteInput> inputs = parse(content);
        log.info("Read {} note inputs from {}", inputs.size(), file);
        return inputs;
    }

    public List<NoteInput> parse(String content) throws IOException {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String trimmed = content.strip();
        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            return parseJson(trimmed);
        }
        return parsePlainText(content);
    }

    private List<NoteInput> parseJson(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        JsonNode array = root.isObject() ? root.path("notes") : root;
        if (!array.isArray()) {
            throw new IOException("Expected a JSON array of notes");
        }

        List<NoteInput> inputs = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            inputs.add(toInput(node));
        }
        return inputs;
    }

    private NoteInput toInput(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return NoteInput.of(node.asText());
        }
        if (!node.isObject()) {
            log.warn("Ignoring non-object note entry: {}", node.getNodeType());
            return NoteInput.builder().build();
        }

        JsonNode text = node.get("text");
        JsonNode id = node.get("id");
        JsonNode role = node.get("sourceRole");
        JsonNode sequence = node.get("sequenceIndex");

        return NoteInput.builder()
            .id(id != null && (id.isTextual() || id.isNumber()) ? id.asText() : null)
            .text(text != null && text.isTextual() ? text.asText() : null)
            .sourceRole(role != null && role.isTextual() ? role.asText() : null)
            .sequenceIndex(sequence != null && sequence.canConvertToInt() && sequence.isIntegralNumber()
                ? sequence.asInt() : null)
            .build();
    }

    private List<NoteInput> parsePlainText(String content) {
        List<NoteInput> inputs = new ArrayList<>();
        for (String block : SEPARATOR.split(content)) {
            if (!block.isBlank()) {
                inputs.add(NoteInput.of(block.strip()));
            }
        }
        return inputs;
    }
}
