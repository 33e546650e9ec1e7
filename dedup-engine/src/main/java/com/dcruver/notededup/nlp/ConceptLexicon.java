package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.Concept;
import com.dcruver.notededup.domain.ConceptCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Versioned keyword-to-category map for clinical concepts.
 * Loaded once from JSON and queried by pure lookup; synonyms resolve to a canonical token.
 */
@Slf4j
public class ConceptLexicon {

    public static final String DEFAULT_RESOURCE = "lexicon/clinical-concepts-v1.json";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final String version;
    private final Map<String, Set<Concept>> phrases;
    private final Set<String> temporalAnchors;
    private final int maxPhraseLength;

    ConceptLexicon(String version, Map<String, Set<Concept>> phrases, Set<String> temporalAnchors) {
        this.version = version;
        this.phrases = phrases;
        this.temporalAnchors = temporalAnchors;
        this.maxPhraseLength = phrases.keySet().stream()
            .mapToInt(phrase -> phrase.split(" ").length)
            .max()
            .orElse(0);
    }

    /**
     * Load the lexicon bundled with the engine.
     */
    public static ConceptLexicon loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Load a lexicon from the classpath.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static ConceptLexicon loadResource(String resource) {
        ClassLoader classLoader = ConceptLexicon.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Concept lexicon not found on classpath: " + resource);
            }
            ConceptLexicon lexicon = load(in);
            log.info("Loaded concept lexicon {} from {} ({} phrases)", lexicon.getVersion(), resource, lexicon.size());
            return lexicon;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read concept lexicon " + resource, e);
        }
    }

    /**
     * Parse a lexicon document.
     */
    public static ConceptLexicon load(InputStream in) throws IOException {
        LexiconDocument document = new ObjectMapper().readValue(in, LexiconDocument.class);
        return fromDocument(document);
    }

    static ConceptLexicon fromDocument(LexiconDocument document) {
        Map<String, Set<Concept>> phrases = new HashMap<>();

        if (document.getCategories() != null) {
            for (Map.Entry<ConceptCategory, Map<String, List<String>>> category : document.getCategories().entrySet()) {
                if (category.getKey() == ConceptCategory.TEMPORAL) {
                    throw new IllegalArgumentException("TEMPORAL concepts come from temporalAnchors, not categories");
                }
                for (Map.Entry<String, List<String>> entry : category.getValue().entrySet()) {
                    String canonical = normalizePhrase(entry.getKey());
                    if (canonical.isEmpty()) {
                        continue;
                    }
                    Concept concept = new Concept(category.getKey(), canonical);
                    register(phrases, canonical, concept);
                    if (entry.getValue() != null) {
                        for (String synonym : entry.getValue()) {
                            register(phrases, normalizePhrase(synonym), concept);
                        }
                    }
                }
            }
        }

        Set<String> anchors = new HashSet<>();
        if (document.getTemporalAnchors() != null) {
            for (String anchor : document.getTemporalAnchors()) {
                String normalized = normalizePhrase(anchor);
                if (!normalized.isEmpty()) {
                    anchors.add(normalized);
                }
            }
        }

        return new ConceptLexicon(document.getVersion(), phrases, anchors);
    }

    private static void register(Map<String, Set<Concept>> phrases, String phrase, Concept concept) {
        if (!phrase.isEmpty()) {
            phrases.computeIfAbsent(phrase, key -> new LinkedHashSet<>()).add(concept);
        }
    }

    /**
     * Lowercase, strip punctuation and collapse whitespace, the same shape as normalized note text.
     */
    static String normalizePhrase(String phrase) {
        if (phrase == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(phrase.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Concepts for an exact normalized phrase, empty if unknown.
     */
    public Set<Concept> lookup(String phrase) {
        Set<Concept> concepts = phrases.get(phrase);
        return concepts != null ? Collections.unmodifiableSet(concepts) : Set.of();
    }

    public boolean isTemporalAnchor(String token) {
        return temporalAnchors.contains(token);
    }

    public String getVersion() {
        return version;
    }

    public int getMaxPhraseLength() {
        return maxPhraseLength;
    }

    public int size() {
        return phrases.size();
    }

    /**
     * JSON shape of a lexicon resource.
     */
    @Data
    public static class LexiconDocument {
        private String version;
        private List<String> temporalAnchors;

        // category -> canonical token -> synonyms
        private Map<ConceptCategory, Map<String, List<String>>> categories;
    }
}
