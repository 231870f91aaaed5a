/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.scan;

import io.scrubflow4j.core.api.model.RedactionTypes;
import io.scrubflow4j.core.detect.EntropyDetector;
import io.scrubflow4j.core.detect.SecretPattern;
import io.scrubflow4j.core.preset.BuiltInPatterns;
import io.scrubflow4j.core.session.Message;
import io.scrubflow4j.core.session.Session;
import io.scrubflow4j.core.session.ToolUse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only second pass run right before output is persisted or published. Re-applies every library
 * pattern (with its allow predicate) and the entropy detector, which here runs unconditionally.
 * Placeholders never match, so a clean redaction produces no hits.
 */
public final class PostRedactionScanner {
    private final List<SecretPattern> patterns;
    private final EntropyDetector entropy;

    public PostRedactionScanner(List<SecretPattern> patterns, EntropyDetector entropy) {
        this.patterns = List.copyOf(patterns);
        this.entropy = Objects.requireNonNull(entropy, "entropy");
    }

    public PostRedactionScanner() {
        this(BuiltInPatterns.all(), EntropyDetector.defaults());
    }

    public List<ScanHit> scan(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<ScanHit> hits = new ArrayList<>();
        for (SecretPattern p : patterns) {
            for (String match : p.findAll(text)) hits.add(ScanHit.of(p.name(), match));
        }
        for (String token : entropy.findHighEntropyTokens(text)) {
            hits.add(ScanHit.of(RedactionTypes.HIGH_ENTROPY, token));
        }
        return hits;
    }

    public List<String> scanForRemaining(String text) {
        List<ScanHit> hits = scan(text);
        List<String> out = new ArrayList<>(hits.size());
        for (ScanHit h : hits) out.add(h.describe());
        return out;
    }

    /** Scans the same fields {@link io.scrubflow4j.core.session.SessionRedactor} rewrites. */
    public List<ScanHit> scanSession(Session session) {
        Objects.requireNonNull(session, "session");
        List<ScanHit> hits = new ArrayList<>();
        for (Message msg : session.messages()) {
            hits.addAll(scan(msg.content()));
            hits.addAll(scan(msg.thinking()));
            for (ToolUse tu : msg.toolUses()) {
                hits.addAll(scan(tu.inputSummary()));
                hits.addAll(scan(tu.result()));
            }
        }
        return hits;
    }
}
