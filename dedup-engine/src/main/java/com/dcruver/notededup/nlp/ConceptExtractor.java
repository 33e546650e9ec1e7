package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.Concept;
import com.dcruver.notededup.domain.NormalizedText;

import java.util.Set;

/**
 * Extracts category-qualified concepts from normalized text.
 */
public interface ConceptExtractor {

    Set<Concept> extract(NormalizedText text);
}
