/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.api.model;

/** Output of one replacement stage: the rewritten text and how many occurrences were replaced. */
public record Substitution(String text, int count) {
    public static Substitution unchanged(String text) {
        return new Substitution(text, 0);
    }

    public boolean changed() {
        return count > 0;
    }
}
