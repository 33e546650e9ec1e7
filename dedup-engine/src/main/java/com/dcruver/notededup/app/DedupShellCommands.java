package com.dcruver.notededup.app;

import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.DeduplicationResult;
import com.dcruver.notededup.domain.Note;
import com.dcruver.notededup.domain.NoteAnalyzer;
import com.dcruver.notededup.domain.PriorityScore;
import com.dcruver.notededup.domain.SimilarityScore;
import com.dcruver.notededup.domain.SourceRole;
import com.dcruver.notededup.domain.pipeline.Deadline;
import com.dcruver.notededup.domain.pipeline.DedupPipeline;
import com.dcruver.notededup.domain.pipeline.NoteIngestor;
import com.dcruver.notededup.domain.pipeline.NoteIngestor.IngestionResult;
import com.dcruver.notededup.io.DedupReportWriter;
import com.dcruver.notededup.io.DedupResultWriter;
import com.dcruver.notededup.io.NoteInput;
import com.dcruver.notededup.io.NoteInputReader;
import com.dcruver.notededup.nlp.SourceRoleClassifier;
import com.dcruver.notededup.similarity.SimilarityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for the note dedup engine.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class DedupShellCommands {

    private final DedupPipeline pipeline;
    private final NoteIngestor ingestor;
    private final NoteInputReader inputReader;
    private final DedupResultWriter resultWriter;
    private final DedupReportWriter reportWriter;
    private final SimilarityScorer similarityScorer;
    private final NoteAnalyzer noteAnalyzer;
    private final SourceRoleClassifier roleClassifier;
    private final DedupConfig config;

    @ShellMethod(key = {"dedup", "deduplicate"}, value = "Deduplicate the notes in a JSON or plain-text file")
    public String dedup(
            @ShellOption String file,
            @ShellOption(defaultValue = ShellOption.NULL) String output,
            @ShellOption(defaultValue = "false") boolean diff) {
        log.info("Deduplicating notes from {}", file);

        try {
            List<NoteInput> inputs = inputReader.read(Path.of(file));
            IngestionResult ingestion = ingestor.ingest(inputs);
            DeduplicationResult result = pipeline.execute(ingestion, Deadline.after(config.getTimeout()));

            StringBuilder out = new StringBuilder();
            out.append(reportWriter.render(ingestion.notes(), result, diff));

            if (output != null) {
                resultWriter.write(result, Path.of(output));
                out.append(String.format("\nResult written to %s\n", output));
            }
            return out.toString();

        } catch (Exception e) {
            log.error("Deduplication failed", e);
            return "Deduplication failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "similarity", value = "Show the similarity components between two texts")
    public String similarity(@ShellOption String a, @ShellOption String b) {
        SimilarityScore score = similarityScorer.score(a, b, config.getWeights());

        StringBuilder result = new StringBuilder();
        result.append(String.format("Jaccard:     %.3f\n", score.getJaccard()));
        result.append(String.format("Levenshtein: %.3f\n", score.getLevenshtein()));
        result.append(String.format("Semantic:    %.3f\n", score.getSemantic()));
        result.append(String.format("Combined:    %.3f\n", score.getCombined()));
        result.append("\n");

        if (score.isAtLeast(config.getThresholdNear())) {
            result.append(String.format("Near-duplicate (>= %.2f)\n", config.getThresholdNear()));
        } else if (score.isWithin(config.getComplementaryMin(), config.getComplementaryMax())) {
            result.append(String.format("Complementary band [%.2f, %.2f)\n",
                config.getComplementaryMin(), config.getComplementaryMax()));
        } else {
            result.append("Distinct\n");
        }
        return result.toString();
    }

    @ShellMethod(key = "priority", value = "Show the priority score breakdown of a note")
    public String priority(
            @ShellOption String text,
            @ShellOption(defaultValue = ShellOption.NULL) String role) {
        SourceRole sourceRole = roleClassifier.classify(role);
        AnalyzedNote analyzed = noteAnalyzer.analyze(Note.ingested("cli", text, sourceRole, 0));
        PriorityScore score = analyzed.getPriority();

        StringBuilder result = new StringBuilder();
        result.append(String.format("Role: %s\n", sourceRole.getTag()));
        result.append(String.format("- Length (chars/100):   %.2f\n", score.getLengthComponent()));
        result.append(String.format("- Entities (x10):       %d\n", score.getEntityCount()));
        result.append(String.format("- Temporal markers (x5): %d %s\n", score.getTemporalMarkerCount(),
            analyzed.getTemporalMarkers()));
        result.append(String.format("- Role bonus:           %d\n", score.getRoleBonus()));
        result.append(String.format("- Operative mentions (x15): %d\n", score.getOperativeMentions()));
        result.append(String.format("Priority: %.2f\n", score.getScore()));
        return result.toString();
    }

    @ShellMethod(key = "config", value = "Show the effective dedup configuration")
    public String config() {
        StringBuilder result = new StringBuilder();
        result.append("Dedup configuration:\n");
        result.append(String.format("- Weights: jaccard %.2f, levenshtein %.2f, semantic %.2f\n",
            config.getWeights().jaccard(), config.getWeights().levenshtein(), config.getWeights().semantic()));
        result.append(String.format("- Near-duplicate threshold: %.2f\n", config.getThresholdNear()));
        result.append(String.format("- Sentence threshold: %.2f\n", config.getThresholdSentence()));
        result.append(String.format("- Complementary band: [%.2f, %.2f)\n",
            config.getComplementaryMin(), config.getComplementaryMax()));
        result.append(String.format("- Preserve chronology: %s\n", config.isPreserveChronology()));
        result.append(String.format("- Merge complementary: %s\n", config.isMergeComplementary()));
        result.append(String.format("- Timeout: %s\n", config.hasTimeout() ? config.getTimeout() : "none"));
        result.append(String.format("- Min sentence words for fuzzy match: %d\n", config.getMinSentenceWords()));
        return result.toString();
    }
}
