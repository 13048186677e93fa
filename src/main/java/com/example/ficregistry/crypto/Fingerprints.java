package com.example.ficregistry.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way fingerprints used to correlate log and audit lines without exposing the value.
 */
public final class Fingerprints {

    public static final int LENGTH = 16;

    private Fingerprints() {
    }

    /**
     * First {@value #LENGTH} hex chars of the SHA-256 of the UTF-8 value. Blank values
     * return an empty string.
     */
    public static String of(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, LENGTH);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
