/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.detect;

import io.scrubflow4j.core.api.model.RedactionTypes;
import io.scrubflow4j.core.api.model.Substitution;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One named detector of the pattern library: a match rule, a placeholder builder and an optional
 * per-match allow predicate.
 *
 * <p>Instances are immutable and shared. {@link Pattern} is thread-safe, {@link Matcher} is not,
 * so every call creates its own matcher and no cursor state survives between calls.
 *
 * @param name        category name reported when this pattern fires
 * @param pattern     compiled match rule (flags are part of the pattern)
 * @param placeholder builds the replacement from the raw match
 * @param allow       if non-null and true for a match, that match is left untouched and not counted
 */
public record SecretPattern(
        String name, Pattern pattern, Function<String, String> placeholder, Predicate<String> allow) {

    public SecretPattern {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(placeholder, "placeholder");
    }

    /** Whole match becomes {@code [REDACTED:<name>]}. */
    public static SecretPattern masked(String name, String regex) {
        return masked(name, regex, null);
    }

    public static SecretPattern masked(String name, String regex, Predicate<String> allow) {
        String mask = RedactionTypes.placeholder(name);
        return new SecretPattern(name, Pattern.compile(regex), m -> mask, allow);
    }

    /** Placeholder computed from the match, e.g. to keep a non-secret prefix. */
    public static SecretPattern rewritten(String name, String regex, Function<String, String> placeholder) {
        return new SecretPattern(name, Pattern.compile(regex), placeholder, null);
    }

    /** Replaces every non-allowed match; the count excludes allowed matches. */
    public Substitution apply(String text) {
        if (text == null || text.isEmpty()) return Substitution.unchanged(text);
        Matcher m = pattern.matcher(text);
        StringBuilder out = null;
        int count = 0;
        while (m.find()) {
            String match = m.group();
            if (isAllowed(match)) continue;
            if (out == null) out = new StringBuilder(text.length());
            m.appendReplacement(out, Matcher.quoteReplacement(placeholder.apply(match)));
            count++;
        }
        if (out == null) return Substitution.unchanged(text);
        m.appendTail(out);
        return new Substitution(out.toString(), count);
    }

    /** Read-only: every non-allowed match, in order of appearance. */
    public List<String> findAll(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<String> hits = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String match = m.group();
            if (!isAllowed(match)) hits.add(match);
        }
        return hits;
    }

    private boolean isAllowed(String match) {
        return allow != null && allow.test(match);
    }
}
