package com.dcruver.notededup.io;

import com.dcruver.notededup.domain.DeduplicationResult;
import com.dcruver.notededup.domain.InputError;
import com.dcruver.notededup.domain.Note;
import com.dcruver.notededup.domain.PhaseExecution;
import com.dcruver.notededup.domain.PhaseFailure;
import com.dcruver.notededup.domain.PhaseStats;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a human-readable dedup report, with unified diffs for notes whose text changed.
 */
@Component
public class DedupReportWriter {

    /**
     * @param inputNotes ingested notes, used to reconstruct each output note's original text
     */
    public String render(List<Note> inputNotes, DeduplicationResult result, boolean includeDiffs) {
        StringBuilder report = new StringBuilder();
        report.append("Deduplication report\n\n");
        report.append(String.format("- Input notes: %d\n", result.getInputCount()));
        report.append(String.format("- Output notes: %d\n", result.getOutputCount()));
        report.append(String.format("- Reduction: %.1f%%\n", result.getReductionPercent()));
        report.append(String.format("- Clusters: %d\n", result.getClusterCount()));
        if (result.isPartial()) {
            report.append("- PARTIAL: deadline reached, later phases did not run\n");
        }
        report.append("\n");

        PhaseStats stats = result.getPhaseStats();
        report.append("Phases:\n");
        for (PhaseExecution execution : stats.getExecutions()) {
            String status = execution.isSkipped() ? "-" : execution.isSuccess() ? "✓" : "✗";
            report.append(String.format("%s %s: %s (%d ms)\n", status, execution.getPhaseName(),
                execution.getMessage(), execution.getElapsed() != null ? execution.getElapsed().toMillis() : 0));
        }
        report.append(String.format("Removed: %d exact, %d near, %d sentences (%d notes emptied), %d merges\n",
            stats.getExactDuplicatesRemoved(), stats.getNearDuplicatesRemoved(), stats.getSentencesRemoved(),
            stats.getNotesRemovedBySentenceDedup(), stats.getComplementaryMerges()));

        if (stats.hasErrors()) {
            report.append("\nErrors:\n");
            for (PhaseFailure error : stats.getErrors()) {
                report.append(String.format("- %s: %s %s\n", error.phase(), error.exceptionType(), error.message()));
            }
        }
        if (stats.getWarnings() != null && !stats.getWarnings().isEmpty()) {
            report.append("\nSkipped inputs:\n");
            for (InputError warning : stats.getWarnings()) {
                report.append(String.format("- #%d: %s\n", warning.index(), warning.reason()));
            }
        }

        report.append("\nNotes:\n");
        int position = 1;
        for (Note note : result.getNotes()) {
            report.append(String.format("%d. %s [%s] seq=%d sources=%s\n", position++, note.getId(),
                note.getSourceRole().getTag(), note.getSequenceIndex(), note.getSourceNoteIds()));
        }

        if (includeDiffs) {
            Map<String, Note> inputsById = new LinkedHashMap<>();
            for (Note input : inputNotes) {
                inputsById.put(input.getId(), input);
            }
            for (Note note : result.getNotes()) {
                String original = originalText(note, inputsById);
                String revised = note.getRawText().strip();
                if (!original.equals(revised)) {
                    report.append("\n").append(generateDiff(original, revised, note.getId())).append("\n");
                }
            }
        }

        return report.toString();
    }

    /**
     * Generate a unified diff between two versions of a note
     */
    public String generateDiff(String original, String revised, String noteId) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = revised.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
            "original/" + noteId,
            "deduplicated/" + noteId,
            originalLines,
            patch,
            3  // context lines
        );

        return String.join("\n", unifiedDiff);
    }

    // Source notes' texts in provenance order
    private static String originalText(Note note, Map<String, Note> inputsById) {
        List<String> parts = new ArrayList<>();
        for (String sourceId : note.getSourceNoteIds()) {
            Note source = inputsById.get(sourceId);
            if (source != null) {
                parts.add(source.getRawText().strip());
            }
        }
        return String.join("\n", parts);
    }
}
