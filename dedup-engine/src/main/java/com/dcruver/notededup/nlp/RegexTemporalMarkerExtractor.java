package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.TemporalMarker;
import com.dcruver.notededup.domain.TemporalMarker.Kind;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based temporal marker extraction.
 * Dates are normalized to ISO form when they parse as month/day/year.
 */
public class RegexTemporalMarkerExtractor implements TemporalMarkerExtractor {

    private static final Pattern DATE = Pattern.compile("\\b(\\d{1,2})[/-](\\d{1,2})[/-](\\d{2,4})\\b");
    private static final Pattern POD = Pattern.compile(
        "\\b(?:POD|post[- ]?op(?:erative)?\\s+day)\\s*#?\\s*(\\d+)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIVE = Pattern.compile(
        "\\b(yesterday|today|tonight|overnight|this morning|this evening|\\d+\\s+days?\\s+ago)\\b",
        Pattern.CASE_INSENSITIVE);

    @Override
    public List<TemporalMarker> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<TemporalMarker> markers = new ArrayList<>();

        Matcher date = DATE.matcher(text);
        while (date.find()) {
            markers.add(new TemporalMarker(Kind.DATE, normalizeDate(date)));
        }

        Matcher pod = POD.matcher(text);
        while (pod.find()) {
            markers.add(new TemporalMarker(Kind.POD, "POD " + Integer.parseInt(pod.group(1))));
        }

        Matcher relative = RELATIVE.matcher(text);
        while (relative.find()) {
            String phrase = relative.group(1).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            markers.add(new TemporalMarker(Kind.RELATIVE, phrase));
        }

        return markers;
    }

    private static String normalizeDate(Matcher matcher) {
        int month = Integer.parseInt(matcher.group(1));
        int day = Integer.parseInt(matcher.group(2));
        int year = Integer.parseInt(matcher.group(3));
        if (matcher.group(3).length() == 2) {
            year += 2000;
        }
        try {
            return LocalDate.of(year, month, day).toString();
        } catch (DateTimeException e) {
            // Not a month/day/year date; keep the literal so equal strings still match
            return matcher.group();
        }
    }
}
