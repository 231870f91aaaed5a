/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.api.model;

/** Redactions of one category within a single call (type + count), useful for metrics. */
public record Finding(String type, int count) {}
