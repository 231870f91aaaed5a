/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.preset;

import io.scrubflow4j.core.allow.EmailAllowlist;
import io.scrubflow4j.core.allow.IpAllowlist;
import io.scrubflow4j.core.api.model.RedactionTypes;
import io.scrubflow4j.core.detect.SecretPattern;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The built-in pattern library, in application order.
 *
 * <h3>Ordering</h3>
 * Every pattern runs against the output of the previous one, so an earlier pattern can consume text
 * a later one would also match (a {@code Bearer eyJ...} header is redacted as {@code bearer-token}
 * before {@code jwt} sees it; {@code anthropic-key} runs before the broader {@code openai-key}).
 * Patterns that capture a value after a key ({@code password}, {@code cli-secret},
 * {@code url-secret}, {@code env-secret}) refuse a value starting with {@code [REDACTED:} so an
 * earlier placeholder is never redacted twice.
 */
public final class BuiltInPatterns {

    private static final String NOT_REDACTED = "(?!\\[REDACTED:)";

    // ASCII-only word boundaries; on JDK 17 \b counts any Unicode letter as a word character
    private static final String WORD_START = "(?<![A-Za-z0-9_])";
    private static final String WORD_END = "(?![A-Za-z0-9_])";

    private static final List<SecretPattern> ALL = List.of(
            // --- 1) Vendor tokens ---
            SecretPattern.masked("github-token", WORD_START + "ghp_[A-Za-z0-9]{36,}" + WORD_END),
            SecretPattern.masked("github-oauth", WORD_START + "gho_[A-Za-z0-9]{36,}" + WORD_END),
            SecretPattern.masked("github-app-token", WORD_START + "ghs_[A-Za-z0-9]{36,}" + WORD_END),
            SecretPattern.masked(
                    "github-fine-grained-token", WORD_START + "github_pat_[A-Za-z0-9_]{22,}" + WORD_END),
            SecretPattern.masked("anthropic-key", WORD_START + "sk-ant-[A-Za-z0-9\\-_]{32,}" + WORD_END),
            SecretPattern.masked("openai-key", WORD_START + "sk-[A-Za-z0-9]{32,}" + WORD_END),
            SecretPattern.masked("huggingface-token", WORD_START + "hf_[A-Za-z0-9]{32,}" + WORD_END),
            SecretPattern.masked("slack-token", WORD_START + "xox[abprs]-[A-Za-z0-9-]{8,}" + WORD_END),
            SecretPattern.masked(
                    "stripe-key", WORD_START + "(?:sk|rk)_(?:live|test)_[A-Za-z0-9]{10,}" + WORD_END),

            // --- 2) Cloud credentials ---
            SecretPattern.masked("aws-access-key", WORD_START + "(?:AKIA|ASIA|AROA|AIDA)[A-Z0-9]{16}" + WORD_END),
            SecretPattern.masked(
                    "aws-secret-key",
                    "(?i)aws[_\\-]?secret[_\\-]?(?:access[_\\-]?)?key[\"']?\\s*[:=]\\s*[\"']?[A-Za-z0-9/+=]{40}"),

            // --- 3) Headers, key material, passwords ---
            SecretPattern.rewritten(
                    "bearer-token",
                    "(?i)" + WORD_START + "Bearer\\s+[A-Za-z0-9\\-._~+/]{20,}=*",
                    m -> keepKeyword(m, "bearer-token")),
            SecretPattern.masked(
                    "private-key",
                    "-----BEGIN (?:RSA |EC |DSA |OPENSSH |PGP )?(?:PRIVATE KEY|CERTIFICATE|PUBLIC KEY)-----"
                            + "[\\s\\S]*?"
                            + "-----END (?:RSA |EC |DSA |OPENSSH |PGP )?(?:PRIVATE KEY|CERTIFICATE|PUBLIC KEY)-----"),
            SecretPattern.masked(
                    "password",
                    "(?i)(?:password|passwd|pwd)\\s*[:=]\\s*"
                            + "(?:[\"']" + NOT_REDACTED + "[^\"'\\s]{8,}[\"']"
                            + "|" + NOT_REDACTED + "[^\\s\"',;}{]{8,})"),
            SecretPattern.masked(
                    "connection-string",
                    "(?i)" + WORD_START + "(?:mongodb(?:\\+srv)?|postgres(?:ql)?|mysql|mariadb|redis|rediss|amqp)"
                            + "://[^:\\s/@]+:[^@\\s]+@[^\\s\"')]+"),
            SecretPattern.masked("jwt", WORD_START + "eyJ[A-Za-z0-9\\-_]+\\.[A-Za-z0-9\\-_]+\\.[A-Za-z0-9\\-_]+"),
            SecretPattern.masked("pypi-token", WORD_START + "pypi-[A-Za-z0-9\\-_]{32,}" + WORD_END),
            SecretPattern.masked("npm-token", WORD_START + "npm_[A-Za-z0-9]{36,}" + WORD_END),

            // --- 4) Webhooks ---
            SecretPattern.masked("slack-webhook", "https://hooks\\.slack\\.com/services/[A-Za-z0-9/]+"),
            SecretPattern.masked(
                    "discord-webhook", "https://discord(?:app)?\\.com/api/webhooks/[0-9]+/[A-Za-z0-9\\-_]+"),

            // --- 5) Key/value forms: keep the key, redact the value ---
            SecretPattern.rewritten(
                    "cli-secret",
                    "(?i)--(?:token|api[_-]?key|secret|password|passwd|api[_-]?secret)\\s+"
                            + NOT_REDACTED + "[^\\s'\"]{8,}",
                    m -> keepKeyword(m, "cli-secret")),
            SecretPattern.rewritten(
                    "url-secret",
                    "(?i)[?&](?:token|api[_-]?key|secret|password|access[_-]?token)="
                            + NOT_REDACTED + "[^&\\s'\"]{8,}",
                    m -> keepThroughEquals(m, "url-secret")),
            SecretPattern.rewritten(
                    "env-secret",
                    WORD_START + "(?:export\\s+)?[A-Za-z][A-Za-z0-9_]{2,}"
                            + "(?:_TOKEN|_KEY|_SECRET|_PASSWORD|_API_KEY|_CREDENTIALS?|_ACCESS_TOKEN|_PRIVATE_KEY)"
                            + "\\s*=\\s*" + NOT_REDACTED + "[^\\s'\"]{8,}",
                    m -> keepThroughEquals(m, "env-secret")),

            // --- 6) Personal data ---
            SecretPattern.masked(
                    "email",
                    WORD_START + "[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}" + WORD_END,
                    EmailAllowlist::isAllowed),
            SecretPattern.masked(
                    "ipv4", WORD_START + "(?:\\d{1,3}\\.){3}\\d{1,3}" + WORD_END, IpAllowlist::isAllowed),
            SecretPattern.masked(
                    "phone",
                    WORD_START + "(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}" + WORD_END),
            SecretPattern.masked(
                    "credit-card",
                    WORD_START
                            + "(?:4[0-9]{12}(?:[0-9]{3})?|5[1-5][0-9]{14}|3[47][0-9]{13}|6(?:011|5[0-9]{2})[0-9]{12})"
                            + WORD_END));

    private static final Set<String> NAMES;

    static {
        Set<String> names = new LinkedHashSet<>();
        for (SecretPattern p : ALL) {
            if (!names.add(p.name())) {
                throw new IllegalStateException("Duplicate pattern name: " + p.name());
            }
        }
        NAMES = Collections.unmodifiableSet(names);
    }

    private BuiltInPatterns() {}

    /** Immutable, ordered. */
    public static List<SecretPattern> all() {
        return ALL;
    }

    /** Pattern names in application order. */
    public static Set<String> names() {
        return NAMES;
    }

    public static Optional<SecretPattern> byName(String name) {
        return ALL.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /** Leading keyword ({@code --flag}, {@code Bearer}) and the whitespace after it kept as written. */
    private static String keepKeyword(String match, String type) {
        int i = 0;
        while (i < match.length() && !Character.isWhitespace(match.charAt(i))) i++;
        while (i < match.length() && Character.isWhitespace(match.charAt(i))) i++;
        return match.substring(0, i) + RedactionTypes.placeholder(type);
    }

    private static String keepThroughEquals(String match, String type) {
        int eq = match.indexOf('=');
        return match.substring(0, eq + 1) + RedactionTypes.placeholder(type);
    }
}
