/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.scan;

/**
 * A match that survived redaction.
 *
 * @param category pattern name, or {@code high-entropy}
 * @param excerpt  the first {@value #MAX_EXCERPT} characters of the match
 */
public record ScanHit(String category, String excerpt) {
    public static final int MAX_EXCERPT = 80;

    public static ScanHit of(String category, String match) {
        String excerpt = match.length() > MAX_EXCERPT ? match.substring(0, MAX_EXCERPT) : match;
        return new ScanHit(category, excerpt);
    }

    /** {@code [category] excerpt}. */
    public String describe() {
        return "[" + category + "] " + excerpt;
    }
}
