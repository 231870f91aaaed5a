/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.api.model;

import java.util.List;

/**
 * Result of redacting one string.
 *
 * @param text           the transformed text
 * @param redactedCount  number of redaction events
 * @param types          categories that fired, first-seen order, no duplicates
 */
public record RedactionResult(String text, int redactedCount, List<String> types) {
    public RedactionResult {
        types = List.copyOf(types);
    }

    public static RedactionResult unchanged(String text) {
        return new RedactionResult(text, 0, List.of());
    }
}
