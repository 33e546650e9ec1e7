package com.dcruver.notededup.domain;

import com.dcruver.notededup.nlp.EntityCounter;
import com.dcruver.notededup.nlp.TemporalMarkerExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores a note's authority and information density.
 * score = length/100 + entities*10 + temporalMarkers*5 + roleBonus + 15 per operative mention.
 * Missing or failing collaborators count as zero.
 */
@Slf4j
public class PriorityScorer {

    public static final int ENTITY_WEIGHT = 10;
    public static final int TEMPORAL_MARKER_WEIGHT = 5;
    public static final int OPERATIVE_MENTION_BONUS = 15;

    private static final Pattern OPERATIVE_MENTION = Pattern.compile(
        "\\b(?:operative|procedure)\\b", Pattern.CASE_INSENSITIVE);

    private final EntityCounter entityCounter;
    private final TemporalMarkerExtractor temporalMarkerExtractor;

    /**
     * @param entityCounter           may be null
     * @param temporalMarkerExtractor may be null
     */
    public PriorityScorer(EntityCounter entityCounter, TemporalMarkerExtractor temporalMarkerExtractor) {
        this.entityCounter = entityCounter;
        this.temporalMarkerExtractor = temporalMarkerExtractor;
    }

    public PriorityScore score(Note note) {
        return score(note, extractMarkers(note.getRawText()));
    }

    /**
     * Score with markers the caller already extracted.
     */
    public PriorityScore score(Note note, List<TemporalMarker> temporalMarkers) {
        String text = note.getRawText() != null ? note.getRawText() : "";
        SourceRole role = note.getSourceRole() != null ? note.getSourceRole() : SourceRole.UNKNOWN;

        double lengthComponent = text.length() / 100.0;
        int entities = countEntities(note.getId(), text);
        int markers = temporalMarkers != null ? temporalMarkers.size() : 0;
        int operativeMentions = countOperativeMentions(text);

        double score = lengthComponent
            + entities * ENTITY_WEIGHT
            + markers * TEMPORAL_MARKER_WEIGHT
            + role.getBonus()
            + operativeMentions * OPERATIVE_MENTION_BONUS;

        return PriorityScore.builder()
            .noteId(note.getId())
            .score(score)
            .lengthComponent(lengthComponent)
            .entityCount(entities)
            .temporalMarkerCount(markers)
            .roleBonus(role.getBonus())
            .operativeMentions(operativeMentions)
            .build();
    }

    /**
     * Extract temporal markers, degrading to none if the extractor is missing or fails.
     */
    public List<TemporalMarker> extractMarkers(String text) {
        if (temporalMarkerExtractor == null) {
            return List.of();
        }
        try {
            List<TemporalMarker> markers = temporalMarkerExtractor.extract(text);
            return markers != null ? markers : List.of();
        } catch (RuntimeException e) {
            log.warn("Temporal marker extraction failed, counting 0 markers: {}", e.getMessage());
            return List.of();
        }
    }

    private int countEntities(String noteId, String text) {
        if (entityCounter == null) {
            return 0;
        }
        try {
            return Math.max(0, entityCounter.count(text));
        } catch (RuntimeException e) {
            log.warn("Entity counting failed for note {}, counting 0 entities: {}", noteId, e.getMessage());
            return 0;
        }
    }

    private static int countOperativeMentions(String text) {
        Matcher matcher = OPERATIVE_MENTION.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
