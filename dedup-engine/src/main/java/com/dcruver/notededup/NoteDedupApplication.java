package com.dcruver.notededup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the clinical note deduplication engine.
 *
 * Collapses redundant clinical notes of one patient episode: exact duplicates,
 * near-duplicates, repeated sentences and complementary same-day notes.
 * Runs as a Spring Shell application; the engine itself is a plain synchronous library.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class NoteDedupApplication {

    public static void main(String[] args) {
        log.info("Starting note dedup engine...");
        SpringApplication.run(NoteDedupApplication.class, args);
    }
}
