/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.api.model;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps later redaction stages away from output of earlier ones.
 *
 * <p>Protected spans are {@code [REDACTED:<type>]} placeholders and {@code user_xxxxxxxx}
 * pseudonyms. A stage run through {@link #outside(String, Function)} only sees the text between
 * them, so a short literal or account name such as {@code pi} cannot turn
 * {@code [REDACTED:pypi-token]} into something downstream tools no longer recognize.
 */
public final class Placeholders {
    private static final Pattern PROTECTED =
            Pattern.compile("\\[REDACTED:[a-z0-9-]+\\]|user_[0-9a-f]{8}(?![0-9a-f])");

    private Placeholders() {}

    /** Applies {@code op} to every unprotected gap and sums the counts; protected spans are copied as-is. */
    public static Substitution outside(String text, Function<String, Substitution> op) {
        if (text == null || text.isEmpty()) return Substitution.unchanged(text);
        Matcher m = PROTECTED.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        int count = 0;
        while (m.find()) {
            count += applyTo(text.substring(last, m.start()), op, out);
            out.append(m.group());
            last = m.end();
        }
        count += applyTo(text.substring(last), op, out);
        return count == 0 ? Substitution.unchanged(text) : new Substitution(out.toString(), count);
    }

    /** Literal (non-regex) replace of every non-overlapping occurrence. */
    public static Substitution replaceLiteral(String text, String literal, String replacement) {
        int n = occurrences(text, literal);
        if (n == 0) return Substitution.unchanged(text);
        return new Substitution(text.replace(literal, replacement), n);
    }

    /** Non-overlapping occurrences, matching {@link String#replace(CharSequence, CharSequence)}. */
    static int occurrences(String text, String needle) {
        if (needle.isEmpty()) return 0;
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) n++;
        return n;
    }

    private static int applyTo(String gap, Function<String, Substitution> op, StringBuilder out) {
        if (gap.isEmpty()) return 0;
        Substitution s = op.apply(gap);
        out.append(s.text());
        return s.count();
    }
}
