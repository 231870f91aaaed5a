/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.session;

/**
 * One tool invocation inside a turn.
 *
 * @param tool          tool name (structural, never redacted)
 * @param inputSummary  human-readable summary of the arguments
 * @param result        tool output, may be null
 */
public record ToolUse(String tool, String inputSummary, String result) {
    public ToolUse withText(String inputSummary, String result) {
        return new ToolUse(tool, inputSummary, result);
    }
}
