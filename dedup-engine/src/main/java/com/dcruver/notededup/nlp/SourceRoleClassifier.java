package com.dcruver.notededup.nlp;

import com.dcruver.notededup.domain.SourceRole;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Resolves free-text source tags ("Attending Note", "PT consult", "PGY-2") to a {@link SourceRole}.
 * Runs once at ingestion.
 */
@Component
public class SourceRoleClassifier {

    // Therapy is checked before consult: "PT consult" is a therapy note
    private static final Pattern PT_OT = Pattern.compile(
        "\\b(pt|ot|physical therap\\w*|occupational therap\\w*|rehab\\w*)\\b");
    private static final Pattern OPERATIVE = Pattern.compile(
        "\\b(operative|op note|procedure|procedural|surgical|brief op)\\b");
    private static final Pattern CONSULTANT = Pattern.compile(
        "\\b(consult\\w*|specialist)\\b");
    private static final Pattern ATTENDING = Pattern.compile(
        "\\b(attending|faculty)\\b");
    private static final Pattern RESIDENT = Pattern.compile(
        "\\b(resident|intern|fellow|pgy-?\\d*|house ?staff)\\b");

    public SourceRole classify(String tag) {
        if (tag == null || tag.isBlank()) {
            return SourceRole.UNKNOWN;
        }

        String normalized = tag.toLowerCase(Locale.ROOT).replace('_', ' ').trim();

        // Exact enum tags first
        for (SourceRole role : SourceRole.values()) {
            if (role.getTag().equals(tag.trim().toLowerCase(Locale.ROOT))) {
                return role;
            }
        }

        if (PT_OT.matcher(normalized).find()) {
            return SourceRole.PT_OT;
        }
        if (OPERATIVE.matcher(normalized).find()) {
            return SourceRole.OPERATIVE;
        }
        if (CONSULTANT.matcher(normalized).find()) {
            return SourceRole.CONSULTANT;
        }
        if (ATTENDING.matcher(normalized).find()) {
            return SourceRole.ATTENDING;
        }
        if (RESIDENT.matcher(normalized).find()) {
            return SourceRole.RESIDENT;
        }
        return SourceRole.UNKNOWN;
    }
}
