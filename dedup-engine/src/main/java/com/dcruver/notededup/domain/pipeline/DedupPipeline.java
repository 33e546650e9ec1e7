package com.dcruver.notededup.domain.pipeline;

import com.dcruver.notededup.domain.AnalyzedNote;
import com.dcruver.notededup.domain.DedupConfig;
import com.dcruver.notededup.domain.DedupPhase;
import com.dcruver.notededup.domain.DedupState;
import com.dcruver.notededup.domain.DeduplicationResult;
import com.dcruver.notededup.domain.Note;
import com.dcruver.notededup.domain.NoteAnalyzer;
import com.dcruver.notededup.domain.PhaseContext;
import com.dcruver.notededup.domain.PhaseExecution;
import com.dcruver.notededup.domain.PhaseFailure;
import com.dcruver.notededup.domain.PhaseResult;
import com.dcruver.notededup.domain.PhaseStats;
import com.dcruver.notededup.domain.pipeline.NoteIngestor.IngestionResult;
import com.dcruver.notededup.io.NoteInput;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the dedup phases in order and assembles the {@link DeduplicationResult}.
 *
 * Fails closed: a phase that throws is logged, recorded as a {@link PhaseFailure} and its
 * input is handed to the next phase unchanged. A run that exceeds its deadline stops and
 * returns the last completed state flagged as partial.
 *
 * The phase sequence repeats until a pass removes nothing, so a second run over the output
 * finds nothing more. Later passes skip phases that failed.
 */
@Slf4j
public class DedupPipeline {

    // Each pass after the first must remove something, so this is only a backstop
    private static final int MAX_PASSES = 16;

    private final DedupConfig config;
    private final NoteIngestor ingestor;
    private final NoteAnalyzer analyzer;
    private final List<DedupPhase> phases;

    public DedupPipeline(DedupConfig config, NoteIngestor ingestor, NoteAnalyzer analyzer, List<DedupPhase> phases) {
        this.config = config;
        this.ingestor = ingestor;
        this.analyzer = analyzer;
        this.phases = List.copyOf(phases);
        log.info("Dedup pipeline configured with phases {}", phases.stream().map(DedupPhase::getName).toList());
    }

    /**
     * Deduplicate caller inputs with the configured timeout.
     */
    public DeduplicationResult run(List<NoteInput> inputs) {
        return run(inputs, Deadline.after(config.getTimeout()));
    }

    public DeduplicationResult run(List<NoteInput> inputs, Deadline deadline) {
        return execute(ingestor.ingest(inputs), deadline);
    }

    /**
     * Deduplicate notes that were already ingested.
     */
    public DeduplicationResult deduplicate(List<Note> notes) {
        return execute(new IngestionResult(List.copyOf(notes), List.of()), Deadline.after(config.getTimeout()));
    }

    public DeduplicationResult execute(IngestionResult ingestion, Deadline deadline) {
        List<Note> notes = ingestion.notes();
        log.info("Deduplicating {} notes ({} inputs skipped)", notes.size(), ingestion.warnings().size());

        List<AnalyzedNote> analyzed = new ArrayList<>(notes.size());
        for (Note note : notes) {
            analyzed.add(analyzer.analyze(note));
        }

        DedupState state = DedupState.initial(analyzed);
        List<PhaseExecution> executions = new ArrayList<>();
        List<PhaseFailure> errors = new ArrayList<>();
        boolean partial = false;

        if (notes.size() < 2) {
            log.info("Nothing to deduplicate with {} notes", notes.size());
            return buildResult(notes.size(), state, executions, errors, ingestion, false);
        }

        PhaseContext context = PhaseContext.builder()
            .config(config)
            .deadline(deadline != null ? deadline : Deadline.none())
            .build();

        // Rewrites can expose duplicates an earlier phase already passed over, so repeat until settled
        List<DedupPhase> pending = phases;
        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            PassOutcome outcome = runPass(pending, state, context, executions, errors);
            boolean progressed = removals(outcome.state()) > removals(state);
            state = outcome.state();
            if (outcome.partial()) {
                partial = true;
                break;
            }
            if (!progressed) {
                break;
            }
            if (pass == MAX_PASSES) {
                log.warn("Stopping after {} passes with changes still pending", MAX_PASSES);
                break;
            }
            // Phases that failed once are not retried on the same notes
            pending = outcome.healthy();
            log.debug("Pass {} changed the notes, running pass {} with {}", pass, pass + 1,
                pending.stream().map(DedupPhase::getName).toList());
        }

        DeduplicationResult result = buildResult(notes.size(), state, executions, errors, ingestion, partial);
        log.info("Deduplication finished: {} -> {} notes ({}% reduction, {} clusters{})",
            result.getInputCount(), result.getOutputCount(),
            String.format("%.1f", result.getReductionPercent()), result.getClusterCount(),
            partial ? ", partial" : "");
        return result;
    }

    private PassOutcome runPass(List<DedupPhase> pending, DedupState state, PhaseContext context,
                                List<PhaseExecution> executions, List<PhaseFailure> errors) {
        List<DedupPhase> healthy = new ArrayList<>();
        for (DedupPhase phase : pending) {
            if (context.getDeadline().isExpired()) {
                log.warn("Deadline reached before phase '{}', returning partial result", phase.getName());
                return new PassOutcome(state, healthy, true);
            }

            if (!phase.canExecute(state, context)) {
                log.debug("Phase '{}' not applicable, skipping", phase.getName());
                executions.add(PhaseExecution.builder()
                    .phaseName(phase.getName())
                    .skipped(true)
                    .message("Preconditions not met")
                    .elapsed(Duration.ZERO)
                    .build());
                healthy.add(phase);
                continue;
            }

            long start = System.nanoTime();
            try {
                log.debug("Executing phase '{}' on {} notes", phase.getName(), state.size());
                PhaseResult result = phase.execute(state, context);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

                if (result.isSuccess() && result.getResultingState() != null) {
                    state = result.getResultingState();
                    healthy.add(phase);
                } else {
                    log.error("Phase '{}' reported failure: {}", phase.getName(), result.getMessage());
                    errors.add(new PhaseFailure(phase.getName(), "PhaseResult", result.getMessage()));
                }

                executions.add(PhaseExecution.builder()
                    .phaseName(phase.getName())
                    .success(result.isSuccess())
                    .message(result.getMessage())
                    .elapsed(elapsed)
                    .build());

            } catch (DeadlineExceededException e) {
                log.warn("Phase '{}' interrupted by deadline, returning partial result: {}", phase.getName(), e.getMessage());
                executions.add(PhaseExecution.builder()
                    .phaseName(phase.getName())
                    .success(false)
                    .message(e.getMessage())
                    .elapsed(Duration.ofNanos(System.nanoTime() - start))
                    .build());
                return new PassOutcome(state, healthy, true);

            } catch (RuntimeException e) {
                log.error("Phase '{}' failed, passing its input through unchanged", phase.getName(), e);
                errors.add(PhaseFailure.of(phase.getName(), e));
                executions.add(PhaseExecution.builder()
                    .phaseName(phase.getName())
                    .success(false)
                    .message("Exception: " + e.getMessage())
                    .elapsed(Duration.ofNanos(System.nanoTime() - start))
                    .build());
            }
        }
        return new PassOutcome(state, healthy, false);
    }

    /**
     * Everything removed so far; every change a phase makes to the notes raises this count.
     */
    private static int removals(DedupState state) {
        return state.getExactDuplicatesRemoved()
            + state.getNearDuplicatesRemoved()
            + state.getSentencesRemoved()
            + state.getNotesRemovedBySentenceDedup()
            + state.getComplementaryMerges();
    }

    private DeduplicationResult buildResult(int inputCount, DedupState state, List<PhaseExecution> executions,
                                            List<PhaseFailure> errors, IngestionResult ingestion, boolean partial) {
        Comparator<AnalyzedNote> order = Comparator.comparingInt(AnalyzedNote::getSequenceIndex);
        if (!config.isPreserveChronology()) {
            order = Comparator.comparingDouble(AnalyzedNote::getScore).reversed()
                .thenComparingInt(AnalyzedNote::getSequenceIndex);
        }
        List<AnalyzedNote> ordered = new ArrayList<>(state.getNotes());
        ordered.sort(order);

        List<Note> outputNotes = ordered.stream().map(AnalyzedNote::getNote).toList();
        int outputCount = outputNotes.size();

        PhaseStats stats = PhaseStats.builder()
            .executions(List.copyOf(executions))
            .exactDuplicatesRemoved(state.getExactDuplicatesRemoved())
            .nearDuplicatesRemoved(state.getNearDuplicatesRemoved())
            .sentencesRemoved(state.getSentencesRemoved())
            .notesRemovedBySentenceDedup(state.getNotesRemovedBySentenceDedup())
            .complementaryMerges(state.getComplementaryMerges())
            .errors(List.copyOf(errors))
            .warnings(ingestion.warnings())
            .build();

        return DeduplicationResult.builder()
            .notes(outputNotes)
            .inputCount(inputCount)
            .outputCount(outputCount)
            .reductionPercent(DeduplicationResult.reductionPercent(inputCount, outputCount))
            .clusterCount(state.isClustered() ? state.getClusters().size() : outputCount)
            .clusters(state.isClustered() ? state.getClusters() : List.of())
            .phaseStats(stats)
            .partial(partial)
            .build();
    }

    private record PassOutcome(DedupState state, List<DedupPhase> healthy, boolean partial) {
    }

    public DedupConfig getConfig() {
        return config;
    }

    public List<DedupPhase> getPhases() {
        return phases;
    }
}
