package com.dcruver.notededup.domain;

import com.dcruver.notededup.domain.TemporalMarker.Kind;

import java.util.Collections;
import java.util.Set;

/**
 * Decides whether two notes describe the same point of the episode.
 */
public class TemporalContextMatcher {

    /**
     * Same context when the notes share a date or POD reference, or when they are adjacent
     * and neither dates nor PODs disagree.
     *
     * @param adjacent whether the notes are neighbours in sequence order
     */
    public boolean sameContext(AnalyzedNote a, AnalyzedNote b, boolean adjacent) {
        Set<String> datesA = a.markerValues(Kind.DATE);
        Set<String> datesB = b.markerValues(Kind.DATE);
        Set<String> podsA = a.markerValues(Kind.POD);
        Set<String> podsB = b.markerValues(Kind.POD);

        if (!Collections.disjoint(datesA, datesB) || !Collections.disjoint(podsA, podsB)) {
            return true;
        }
        if (!adjacent) {
            return false;
        }
        return !conflicts(datesA, datesB) && !conflicts(podsA, podsB);
    }

    private static boolean conflicts(Set<String> a, Set<String> b) {
        return !a.isEmpty() && !b.isEmpty() && Collections.disjoint(a, b);
    }
}
