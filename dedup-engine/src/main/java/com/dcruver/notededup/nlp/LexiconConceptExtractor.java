package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.Concept;
import com.dcruver.notededup.domain.ConceptCategory;
import com.dcruver.notededup.domain.NormalizedText;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Longest-match lexicon lookup over the token stream of a normalized text.
 * Day anchors ("pod", "hd") become TEMPORAL concepts only when followed by a number.
 */
@RequiredArgsConstructor
public class LexiconConceptExtractor implements ConceptExtractor {

    private final ConceptLexicon lexicon;

    @Override
    public Set<Concept> extract(NormalizedText text) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }

        List<String> tokens = text.tokens();
        Set<Concept> concepts = new LinkedHashSet<>();
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);

            if (lexicon.isTemporalAnchor(token) && i + 1 < tokens.size() && isNumber(tokens.get(i + 1))) {
                concepts.add(new Concept(ConceptCategory.TEMPORAL, token + " " + Integer.parseInt(tokens.get(i + 1))));
                i += 2;
                continue;
            }

            int matched = matchLongest(tokens, i, concepts);
            i += Math.max(1, matched);
        }
        return concepts;
    }

    private int matchLongest(List<String> tokens, int start, Set<Concept> concepts) {
        int longest = Math.min(lexicon.getMaxPhraseLength(), tokens.size() - start);
        for (int length = longest; length >= 1; length--) {
            String phrase = String.join(" ", tokens.subList(start, start + length));
            Set<Concept> found = lexicon.lookup(phrase);
            if (!found.isEmpty()) {
                concepts.addAll(found);
                return length;
            }
        }
        return 0;
    }

    private static boolean isNumber(String token) {
        if (token.isEmpty() || token.length() > 4) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
