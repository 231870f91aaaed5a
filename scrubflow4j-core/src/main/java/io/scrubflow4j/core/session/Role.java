/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.session;

public enum Role {
    USER,
    ASSISTANT,
    SYSTEM
}
