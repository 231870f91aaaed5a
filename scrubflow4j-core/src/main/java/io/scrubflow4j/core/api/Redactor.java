/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.api;

import io.scrubflow4j.core.api.model.Finding;
import io.scrubflow4j.core.api.model.Placeholders;
import io.scrubflow4j.core.api.model.RedactionOptions;
import io.scrubflow4j.core.api.model.RedactionResult;
import io.scrubflow4j.core.api.model.RedactionTypes;
import io.scrubflow4j.core.api.model.Substitution;
import io.scrubflow4j.core.detect.EntropyDetector;
import io.scrubflow4j.core.detect.SecretPattern;
import io.scrubflow4j.core.identity.IdentityProvider;
import io.scrubflow4j.core.identity.OperatorIdentity;
import io.scrubflow4j.core.identity.UsernameHasher;
import io.scrubflow4j.core.preset.BuiltInPatterns;
import io.scrubflow4j.core.report.NoopReporter;
import io.scrubflow4j.core.report.Reporter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redaction engine for a single string.
 *
 * <h3>Stages</h3>
 * Each stage rewrites the output of the previous one:
 * <ol>
 *   <li>built-in patterns, in library order,</li>
 *   <li>custom regular expressions ({@code [REDACTED:custom]}); invalid ones are skipped,</li>
 *   <li>literal strings ({@code [REDACTED:user-specified]}),</li>
 *   <li>usernames: OS account name, home directory and configured extras, replaced by
 *       {@code user_xxxxxxxx},</li>
 *   <li>high-entropy tokens ({@code [REDACTED:high-entropy]}), only when opted in.</li>
 * </ol>
 * The count is the number of replaced occurrences over all stages: a literal string, username or
 * high-entropy token that appears three times counts three, not once. The type list keeps the
 * order in which categories first fired.
 *
 * <p>Stages 2 to 5 only rewrite text between placeholders and pseudonyms produced earlier (see
 * {@link Placeholders}), so every {@code [REDACTED:<type>]} in the output stays intact.
 *
 * <p>Stateless apart from immutable collaborators. The identity is read from the
 * {@link IdentityProvider} on every call.
 */
public final class Redactor {
    private static final Logger log = LoggerFactory.getLogger(Redactor.class);

    private final List<SecretPattern> patterns;
    private final EntropyDetector entropy;
    private final IdentityProvider identity;
    private final Reporter reporter;

    public Redactor(
            List<SecretPattern> patterns, EntropyDetector entropy, IdentityProvider identity, Reporter reporter) {
        this.patterns = List.copyOf(patterns);
        this.entropy = Objects.requireNonNull(entropy, "entropy");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.reporter = (reporter == null) ? new NoopReporter() : reporter;
    }

    public Redactor(IdentityProvider identity) {
        this(BuiltInPatterns.all(), EntropyDetector.defaults(), identity, new NoopReporter());
    }

    public RedactionResult redact(String text, RedactionOptions options) {
        Objects.requireNonNull(options, "options");
        if (!options.enabled() || text == null || text.isEmpty()) return RedactionResult.unchanged(text);

        Tally tally = new Tally();
        String result = text;

        // 1) built-in patterns
        for (SecretPattern p : patterns) {
            result = tally.record(p.name(), p.apply(result));
        }

        // 2) custom expressions
        for (String raw : options.customPatterns()) {
            Pattern custom = compileOrNull(raw);
            if (custom == null) continue;
            result = tally.record(RedactionTypes.CUSTOM, Placeholders.outside(result, gap -> replaceAll(custom, gap)));
        }

        // 3) literal strings
        for (String literal : options.redactStrings()) {
            if (literal.isEmpty()) continue;
            String mask = RedactionTypes.placeholder(RedactionTypes.USER_SPECIFIED);
            result = tally.record(
                    RedactionTypes.USER_SPECIFIED,
                    Placeholders.outside(result, gap -> Placeholders.replaceLiteral(gap, literal, mask)));
        }

        // 4) usernames
        result = tally.record(
                RedactionTypes.USERNAME, UsernameHasher.anonymize(result, usernames(options.redactUsernames())));

        // 5) high-entropy tokens
        if (options.redactHighEntropy()) {
            result = tally.record(RedactionTypes.HIGH_ENTROPY, Placeholders.outside(result, this::highEntropy));
        }

        if (tally.total == 0) return RedactionResult.unchanged(text);
        reporter.report(tally.findings());
        return new RedactionResult(result, tally.total, List.copyOf(tally.counts.keySet()));
    }

    public List<SecretPattern> patterns() {
        return patterns;
    }

    /** OS account name and home directory first, then configured extras; blank and duplicate values dropped. */
    private List<String> usernames(List<String> extras) {
        OperatorIdentity op = identity.current();
        Set<String> out = new LinkedHashSet<>();
        addIfPresent(out, op.username());
        addIfPresent(out, op.homeDirectory());
        for (String e : extras) addIfPresent(out, e);
        return new ArrayList<>(out);
    }

    private static void addIfPresent(Set<String> out, String s) {
        if (s != null && !s.isBlank()) out.add(s);
    }

    private static Pattern compileOrNull(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            log.debug("Skipping invalid custom pattern at index {}: {}", e.getIndex(), e.getDescription());
            return null;
        }
    }

    private static Substitution replaceAll(Pattern p, String text) {
        Matcher m = p.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        String mask = Matcher.quoteReplacement(RedactionTypes.placeholder(RedactionTypes.CUSTOM));
        int count = 0;
        while (m.find()) {
            m.appendReplacement(out, mask);
            count++;
        }
        if (count == 0) return Substitution.unchanged(text);
        m.appendTail(out);
        return new Substitution(out.toString(), count);
    }

    /** Each distinct token is replaced everywhere in {@code text}; the count is per occurrence. */
    private Substitution highEntropy(String text) {
        String mask = RedactionTypes.placeholder(RedactionTypes.HIGH_ENTROPY);
        String result = text;
        int count = 0;
        for (String token : new LinkedHashSet<>(entropy.findHighEntropyTokens(text))) {
            Substitution s = Placeholders.replaceLiteral(result, token, mask);
            result = s.text();
            count += s.count();
        }
        return count == 0 ? Substitution.unchanged(text) : new Substitution(result, count);
    }

    /** Per-call accumulator: total count plus per-category counts in first-seen order. */
    private static final class Tally {
        private final Map<String, Integer> counts = new LinkedHashMap<>();
        private int total;

        String record(String type, Substitution s) {
            if (s.changed()) {
                total += s.count();
                counts.merge(type, s.count(), Integer::sum);
            }
            return s.text();
        }

        List<Finding> findings() {
            List<Finding> out = new ArrayList<>(counts.size());
            counts.forEach((type, n) -> out.add(new Finding(type, n)));
            return out;
        }
    }
}
