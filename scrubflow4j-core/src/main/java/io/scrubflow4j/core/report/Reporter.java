/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.report;

import io.scrubflow4j.core.api.model.Finding;
import java.util.List;

/** Receives per-category redaction counts. Never sees the redacted values. */
public interface Reporter {
    void report(List<Finding> findings);
}
