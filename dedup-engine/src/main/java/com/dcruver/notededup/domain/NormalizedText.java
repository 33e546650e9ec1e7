package com.dcruver.notededup.domain;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalized view of a text span, derived once and never mutated.
 */
@Data
@Builder
public class NormalizedText {

    public static final NormalizedText EMPTY = NormalizedText.builder()
        .lowercase("")
        .words(List.of())
        .sentences(List.of())
        .build();

    /**
     * Boilerplate-free, abbreviation-expanded, lowercase text without punctuation
     */
    private final String lowercase;

    /**
     * Content words (stopwords removed) in order of appearance
     */
    private final List<String> words;

    /**
     * Sentences in original casing
     */
    private final List<String> sentences;

    /**
     * Space-joined content words, the form edit distance is computed on
     */
    public String canonical() {
        return String.join(" ", words);
    }

    public Set<String> wordSet() {
        return new LinkedHashSet<>(words);
    }

    public boolean isEmpty() {
        return lowercase == null || lowercase.isEmpty();
    }

    /**
     * Tokens of the lowercase form, stopwords included
     */
    public List<String> tokens() {
        if (isEmpty()) {
            return List.of();
        }
        return List.of(lowercase.split(" "));
    }
}
