package com.dcruver.notededup.io;

import com.dcruver.notededup.domain.DeduplicationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes {@link DeduplicationResult} as pretty-printed JSON.
 */
@Component
@Slf4j
public class DedupResultWriter {

    private final ObjectMapper objectMapper;

    public DedupResultWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    public String toJson(DeduplicationResult result) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
    }

    public void write(DeduplicationResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), result);
        log.info("Wrote deduplication result ({} notes) to {}", result.getOutputCount(), file);
    }
}
