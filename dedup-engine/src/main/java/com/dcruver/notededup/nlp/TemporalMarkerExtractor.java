package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.TemporalMarker;

import java.util.List;

/**
 * Extracts dates, post-operative days and relative time phrases from raw note text.
 */
public interface TemporalMarkerExtractor {

    List<TemporalMarker> extract(String text);
}
