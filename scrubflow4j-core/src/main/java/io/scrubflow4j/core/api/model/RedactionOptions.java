/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.api.model;

import java.util.List;

/**
 * Per-invocation redaction settings. Built once from persisted configuration and passed by value
 * into every redaction call; nothing here is defaulted by the core.
 *
 * @param enabled            master switch; {@code false} makes every redaction a no-op
 * @param customPatterns     user regular expressions, redacted to {@code [REDACTED:custom]}
 * @param redactUsernames    extra identifiers anonymized like the OS username
 * @param redactStrings      literal strings redacted to {@code [REDACTED:user-specified]}
 * @param redactHighEntropy  opt-in entropy-based redaction
 */
public record RedactionOptions(
        boolean enabled,
        List<String> customPatterns,
        List<String> redactUsernames,
        List<String> redactStrings,
        boolean redactHighEntropy) {

    public RedactionOptions {
        customPatterns = copy(customPatterns);
        redactUsernames = copy(redactUsernames);
        redactStrings = copy(redactStrings);
    }

    /** Enabled, no extras, entropy off. */
    public static RedactionOptions enabledOnly() {
        return new RedactionOptions(true, List.of(), List.of(), List.of(), false);
    }

    public static RedactionOptions disabled() {
        return new RedactionOptions(false, List.of(), List.of(), List.of(), false);
    }

    public RedactionOptions withCustomPatterns(List<String> patterns) {
        return new RedactionOptions(enabled, patterns, redactUsernames, redactStrings, redactHighEntropy);
    }

    public RedactionOptions withRedactUsernames(List<String> usernames) {
        return new RedactionOptions(enabled, customPatterns, usernames, redactStrings, redactHighEntropy);
    }

    public RedactionOptions withRedactStrings(List<String> strings) {
        return new RedactionOptions(enabled, customPatterns, redactUsernames, strings, redactHighEntropy);
    }

    public RedactionOptions withRedactHighEntropy(boolean on) {
        return new RedactionOptions(enabled, customPatterns, redactUsernames, redactStrings, on);
    }

    // drops null entries
    private static List<String> copy(List<String> in) {
        if (in == null || in.isEmpty()) return List.of();
        return in.stream().filter(s -> s != null).toList();
    }
}
