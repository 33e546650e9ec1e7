package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.Concept;
import com.dcruver.notededup.domain.ConceptCategory;
import lombok.RequiredArgsConstructor;

/**
 * Counts distinct lexicon concepts in entity categories.
 */
@RequiredArgsConstructor
public class KeywordEntityCounter implements EntityCounter {

    private final TextNormalizer normalizer;
    private final ConceptExtractor conceptExtractor;

    @Override
    public int count(String text) {
        return (int) conceptExtractor.extract(normalizer.normalize(text)).stream()
            .map(Concept::category)
            .filter(ConceptCategory::isEntity)
            .count();
    }
}
