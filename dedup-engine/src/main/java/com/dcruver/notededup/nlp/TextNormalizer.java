package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.NormalizedText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw clinical note text into a {@link NormalizedText}.
 * Stateless; safe to share between threads.
 */
@Component
@Slf4j
public class TextNormalizer {

    // Header lines, title prefix removed up to and including the note type
    private static final Pattern TITLE_LINE = Pattern.compile(
        "^.*?(?:PROGRESS NOTE|ADMISSION NOTE|OPERATIVE NOTE|CONSULTATION NOTE|DISCHARGE SUMMARY)\\s*:?",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER_LINE = Pattern.compile(
        "^\\s*(?:Date|Time|Attending|Resident|MRN|Medical Record Number)\\s*:.*$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern SIGNATURE = Pattern.compile(
        "Electronically signed by.*$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern POD_FORM = Pattern.compile(
        "\\b(?:POD|post[- ]?op(?:erative)?\\s+day)\\s*#?\\s*(\\d+)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern HD_FORM = Pattern.compile(
        "\\b(?:HD|hospital\\s+day)\\s*#?\\s*(\\d+)",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    /**
     * Abbreviations that never end a sentence when followed by a period
     */
    private static final Set<String> NON_TERMINAL_ABBREVIATIONS = Set.of(
        "dr", "mr", "mrs", "ms", "vs", "etc", "e.g", "i.e", "approx", "pod", "hd");

    /**
     * Case-sensitive abbreviation expansions, applied in order
     */
    private static final Map<String, String> ABBREVIATIONS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put("Pt", "patient");
        ABBREVIATIONS.put("pt", "patient");
        ABBREVIATIONS.put("PT", "physical therapy");
        ABBREVIATIONS.put("OT", "occupational therapy");
        ABBREVIATIONS.put("ASA", "aspirin");
        ABBREVIATIONS.put("SAH", "subarachnoid hemorrhage");
        ABBREVIATIONS.put("ICH", "intracerebral hemorrhage");
        ABBREVIATIONS.put("IVH", "intraventricular hemorrhage");
        ABBREVIATIONS.put("SDH", "subdural hematoma");
        ABBREVIATIONS.put("EVD", "external ventricular drain");
        ABBREVIATIONS.put("VPS", "ventriculoperitoneal shunt");
        ABBREVIATIONS.put("s/p", "status post");
        ABBREVIATIONS.put("S/P", "status post");
        ABBREVIATIONS.put("h/o", "history of");
        ABBREVIATIONS.put("f/u", "follow up");
        ABBREVIATIONS.put("w/", "with");
        ABBREVIATIONS.put("b/l", "bilateral");
        ABBREVIATIONS.put("c/o", "complains of");
        ABBREVIATIONS.put("d/c", "discontinue");
        ABBREVIATIONS.put("hx", "history");
        ABBREVIATIONS.put("dx", "diagnosis");
        ABBREVIATIONS.put("tx", "treatment");
        ABBREVIATIONS.put("abx", "antibiotics");
    }

    private static final Map<Pattern, String> ABBREVIATION_PATTERNS = new LinkedHashMap<>();

    static {
        for (Map.Entry<String, String> entry : ABBREVIATIONS.entrySet()) {
            Pattern pattern = Pattern.compile(
                "(?<![A-Za-z0-9/])" + Pattern.quote(entry.getKey()) + "(?![A-Za-z0-9/])");
            ABBREVIATION_PATTERNS.put(pattern, Matcher.quoteReplacement(entry.getValue()));
        }
    }

    // "no" and "not" carry meaning in clinical text and are kept
    private static final Set<String> STOPWORDS = Set.of(
        "a", "an", "the", "and", "or", "but", "of", "on", "in", "at", "to", "for", "with",
        "by", "from", "as", "is", "was", "were", "are", "be", "been", "being", "this", "that",
        "these", "those", "it", "its", "he", "she", "his", "her", "they", "their", "which",
        "who", "whom", "has", "have", "had", "will", "would", "there", "then", "than", "so",
        "also", "into", "onto", "per", "upon");

    /**
     * Normalize text. Null or blank text yields {@link NormalizedText#EMPTY}.
     */
    public NormalizedText normalize(String text) {
        if (text == null || text.isBlank()) {
            return NormalizedText.EMPTY;
        }

        String stripped = stripBoilerplate(text);
        String expanded = expandAbbreviations(canonicalizeDayReferences(stripped));
        String lowercase = NON_ALPHANUMERIC.matcher(expanded.toLowerCase(Locale.ROOT))
            .replaceAll(" ")
            .trim();

        List<String> words = new ArrayList<>();
        if (!lowercase.isEmpty()) {
            for (String token : lowercase.split(" ")) {
                if (!STOPWORDS.contains(token)) {
                    words.add(token);
                }
            }
        }

        return NormalizedText.builder()
            .lowercase(lowercase)
            .words(List.copyOf(words))
            .sentences(splitSentences(stripped))
            .build();
    }

    /**
     * Remove header lines, signature blocks and the note-type title.
     */
    public String stripBoilerplate(String text) {
        if (text == null) {
            return "";
        }

        List<String> kept = new ArrayList<>();
        for (String line : LINE_BREAK.split(text, -1)) {
            if (HEADER_LINE.matcher(line).matches()) {
                continue;
            }
            String cleaned = SIGNATURE.matcher(line).replaceAll("");
            cleaned = TITLE_LINE.matcher(cleaned).replaceFirst("");
            if (!cleaned.isBlank()) {
                kept.add(cleaned.strip());
            }
        }
        return String.join("\n", kept);
    }

    /**
     * Rewrite day references to canonical "POD n" / "HD n" forms.
     */
    public String canonicalizeDayReferences(String text) {
        String pod = POD_FORM.matcher(text).replaceAll("POD $1");
        return HD_FORM.matcher(pod).replaceAll("HD $1");
    }

    /**
     * Expand clinical abbreviations. Case-sensitive: "PT" is physical therapy, "Pt" is the patient.
     */
    public String expandAbbreviations(String text) {
        String result = text;
        for (Map.Entry<Pattern, String> entry : ABBREVIATION_PATTERNS.entrySet()) {
            result = entry.getKey().matcher(result).replaceAll(entry.getValue());
        }
        return result;
    }

    /**
     * Split text into sentences. Lines always break; terminators break unless they close an
     * abbreviation such as "Dr." or "e.g.".
     */
    public List<String> splitSentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> sentences = new ArrayList<>();
        for (String line : LINE_BREAK.split(text)) {
            splitLine(line.strip(), sentences);
        }
        return List.copyOf(sentences);
    }

    private void splitLine(String line, List<String> sentences) {
        if (line.isEmpty()) {
            return;
        }

        Matcher matcher = SENTENCE_BREAK.matcher(line);
        int start = 0;
        while (matcher.find()) {
            String terminator = matcher.group().strip();
            if (".".equals(terminator) && endsWithAbbreviation(line, matcher.start())) {
                continue;
            }
            addSentence(line.substring(start, matcher.start() + terminator.length()), sentences);
            start = matcher.end();
        }
        addSentence(line.substring(start), sentences);
    }

    private boolean endsWithAbbreviation(String line, int terminatorIndex) {
        int wordStart = terminatorIndex;
        while (wordStart > 0 && !Character.isWhitespace(line.charAt(wordStart - 1))) {
            wordStart--;
        }
        String word = line.substring(wordStart, terminatorIndex).toLowerCase(Locale.ROOT);
        return NON_TERMINAL_ABBREVIATIONS.contains(word);
    }

    private static void addSentence(String candidate, List<String> sentences) {
        String sentence = candidate.strip();
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }
    }
}
