/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.session;

import java.util.List;

public record SessionMetadata(List<String> filesTouched, String uploaderVersion) {
    public SessionMetadata {
        filesTouched = (filesTouched == null) ? List.of() : List.copyOf(filesTouched);
    }
}
