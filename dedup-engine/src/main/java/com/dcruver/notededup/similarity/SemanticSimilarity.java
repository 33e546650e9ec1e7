package com.dcruver.notededup.similarity;

import com.dcruver.notededup.domain.Concept;

import java.util.Set;

/**
 * Jaccard over category-qualified concept tokens. No concepts on either side means no signal.
 */
public final class SemanticSimilarity {

    private SemanticSimilarity() {
    }

    public static double of(Set<Concept> a, Set<Concept> b) {
        return JaccardSimilarity.of(a, b);
    }
}
