/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.detect;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statistical fallback for secrets no fixed pattern knows about.
 *
 * <p>Candidates are runs of base64/hex-alphabet characters ({@code [A-Za-z0-9+/=_-]}) of at least
 * {@code minLength} characters. A candidate is flagged when its Shannon entropy reaches
 * {@code threshold} bits/char and {@link #looksLikeSecret(String)} accepts it:
 * <ul>
 *   <li>not a UUID (8-4-4-4-12 hex),</li>
 *   <li>at most two dots (version strings, domain names),</li>
 *   <li>at least one upper-case letter, one lower-case letter and one digit.</li>
 * </ul>
 *
 * <p>The defaults (3.5 bits/char, 32 chars) are empirical tuning values.
 */
public final class EntropyDetector {
    public static final double DEFAULT_THRESHOLD = 3.5;
    public static final int DEFAULT_MIN_LENGTH = 32;

    private static final Pattern UUID =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final double threshold;
    private final int minLength;
    private final Pattern candidate;

    public EntropyDetector(double threshold, int minLength) {
        if (minLength < 1) throw new IllegalArgumentException("minLength must be positive: " + minLength);
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative: " + threshold);
        }
        this.threshold = threshold;
        this.minLength = minLength;
        this.candidate = Pattern.compile("[A-Za-z0-9+/=_\\-]{" + minLength + ",}");
    }

    public static EntropyDetector defaults() {
        return new EntropyDetector(DEFAULT_THRESHOLD, DEFAULT_MIN_LENGTH);
    }

    public double threshold() {
        return threshold;
    }

    public int minLength() {
        return minLength;
    }

    /** Flagged tokens in order of appearance; a token occurring twice is listed twice. */
    public List<String> findHighEntropyTokens(String text) {
        if (text == null || text.length() < minLength) return List.of();
        List<String> out = new ArrayList<>();
        Matcher m = candidate.matcher(text);
        while (m.find()) {
            String token = m.group();
            if (token.length() >= minLength && shannonEntropy(token) >= threshold && looksLikeSecret(token)) {
                out.add(token);
            }
        }
        return out;
    }

    /** Character-frequency Shannon entropy in bits per character; 0 for empty input. */
    public static double shannonEntropy(String s) {
        if (s == null || s.isEmpty()) return 0.0;
        Map<Integer, Integer> freq = new HashMap<>();
        s.codePoints().forEach(cp -> freq.merge(cp, 1, Integer::sum));
        double len = s.codePointCount(0, s.length());
        double entropy = 0.0;
        for (int count : freq.values()) {
            double p = count / len;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    public static boolean looksLikeSecret(String token) {
        if (token == null || token.isEmpty()) return false;
        if (UUID.matcher(token).matches()) return false;

        int dots = 0;
        boolean upper = false, lower = false, digit = false;
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            if (ch == '.') dots++;
            else if (ch >= 'A' && ch <= 'Z') upper = true;
            else if (ch >= 'a' && ch <= 'z') lower = true;
            else if (ch >= '0' && ch <= '9') digit = true;
        }
        if (dots > 2) return false;
        return upper && lower && digit;
    }
}
