/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.session;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

/** Redacted copy of a session plus totals over every redacted field. */
@SuppressFBWarnings
public record SessionRedaction(Session session, int totalRedacted, List<String> types) {
    public SessionRedaction {
        types = List.copyOf(types);
    }
}
