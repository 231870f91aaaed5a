/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

import io.scrubflow4j.core.api.model.Placeholders;
import io.scrubflow4j.core.api.model.Substitution;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;

/**
 * Stable pseudonyms for operator identifiers.
 *
 * <p>{@code hash(name)} is {@code user_} followed by the first 8 hex characters of SHA-256 over the
 * UTF-8 bytes of {@code name}. No salt: the same contributor maps to the same pseudonym in every run.
 */
public final class UsernameHasher {
    public static final String PREFIX = "user_";
    private static final int HEX_CHARS = 8;

    private UsernameHasher() {}

    public static String hash(String username) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(username.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(digest).substring(0, HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Replaces each candidate with its pseudonym. Per candidate, a plain substring pass runs first,
     * then a pass over the hyphen-encoded form {@code -<name>-} used in encoded project directory
     * names. Blank candidates are skipped. Placeholders and pseudonyms already in the text are left
     * alone.
     */
    public static Substitution anonymize(String text, Collection<String> candidates) {
        if (text == null || text.isEmpty() || candidates == null || candidates.isEmpty()) {
            return Substitution.unchanged(text);
        }
        String result = text;
        int count = 0;
        for (String name : candidates) {
            if (name == null || name.isBlank()) continue;
            String hashed = hash(name);

            Substitution plain = Placeholders.outside(result, gap -> Placeholders.replaceLiteral(gap, name, hashed));
            result = plain.text();
            count += plain.count();

            Substitution hyphenated = Placeholders.outside(
                    result, gap -> Placeholders.replaceLiteral(gap, "-" + name + "-", "-" + hashed + "-"));
            result = hyphenated.text();
            count += hyphenated.count();
        }
        return count == 0 ? Substitution.unchanged(text) : new Substitution(result, count);
    }
}
