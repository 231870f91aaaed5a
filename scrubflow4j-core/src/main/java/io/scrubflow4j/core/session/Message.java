/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.session;

import java.util.List;

/**
 * One conversation turn. {@code thinking} and {@code timestamp} may be null; a missing tool list is
 * stored as empty.
 */
public record Message(Role role, String content, String thinking, String timestamp, List<ToolUse> toolUses) {
    public Message {
        toolUses = (toolUses == null) ? List.of() : List.copyOf(toolUses);
    }

    public static Message of(Role role, String content) {
        return new Message(role, content, null, null, List.of());
    }

    public Message withText(String content, String thinking, List<ToolUse> toolUses) {
        return new Message(role, content, thinking, timestamp, toolUses);
    }
}
