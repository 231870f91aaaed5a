/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.session;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/**
 * A normalized conversation as handed over by the log parsers. Only the text inside
 * {@link #messages()} is subject to redaction; identifiers, counters and timestamps are structural.
 */
@SuppressFBWarnings
public record Session(
        String id,
        String tool,
        String workspace,
        String gitBranch,
        String capturedAt,
        String startTime,
        String endTime,
        String model,
        List<Message> messages,
        SessionStats stats,
        SessionMetadata metadata) {

    public Session {
        messages = (messages == null) ? List.of() : List.copyOf(messages);
    }

    public Session withMessages(List<Message> replaced) {
        return new Session(
                id, tool, workspace, gitBranch, capturedAt, startTime, endTime, model, replaced, stats, metadata);
    }
}
