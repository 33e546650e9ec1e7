package com.dcruver.notededup.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hash of a note's normalized text.
 * Only used to group byte-identical notes.
 */
public record Fingerprint(String hex) {

    public static Fingerprint of(NormalizedText text) {
        String content = text != null && text.getLowercase() != null ? text.getLowercase() : "";
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return new Fingerprint(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String shortHex() {
        return hex.substring(0, Math.min(12, hex.length()));
    }
}
