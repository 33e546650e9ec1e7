package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.TemporalMarker;
import com.dcruver.notededup.domain.TemporalMarker.Kind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegexTemporalMarkerExtractorTest {

    private final RegexTemporalMarkerExtractor extractor = new RegexTemporalMarkerExtractor();

    @Test
    void testExtractsAllKinds() {
        List<TemporalMarker> markers = extractor.extract(
            "Seen 3/14/2024 on POD#2, headache since yesterday, drain removed 2 days ago.");

        assertEquals(List.of(
            new TemporalMarker(Kind.DATE, "2024-03-14"),
            new TemporalMarker(Kind.POD, "POD 2"),
            new TemporalMarker(Kind.RELATIVE, "yesterday"),
            new TemporalMarker(Kind.RELATIVE, "2 days ago")), markers);
    }

    @Test
    void testDateFormsNormalizeToSameValue() {
        assertEquals(extractor.extract("03/14/2024"), extractor.extract("3-14-24"));
    }

    @Test
    void testUnparseableDateKeptLiteral() {
        assertEquals(List.of(new TemporalMarker(Kind.DATE, "14/03/2024")), extractor.extract("14/03/2024"));
    }

    @Test
    void testPostOperativeDaySpellings() {
        List<TemporalMarker> markers = extractor.extract("post-op day 5, postoperative day 6, pod 07");

        assertEquals(List.of(
            new TemporalMarker(Kind.POD, "POD 5"),
            new TemporalMarker(Kind.POD, "POD 6"),
            new TemporalMarker(Kind.POD, "POD 7")), markers);
        assertTrue(markers.stream().allMatch(TemporalMarker::isExplicit));
    }

    @Test
    void testNoMarkers() {
        assertTrue(extractor.extract("Stable.").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }
}
