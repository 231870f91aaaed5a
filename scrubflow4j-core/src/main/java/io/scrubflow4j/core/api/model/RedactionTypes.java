/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.api.model;

/**
 * Category names produced by the engine stages that are not built-in patterns.
 * Built-in pattern names are listed by {@link io.scrubflow4j.core.preset.BuiltInPatterns#names()}.
 */
public final class RedactionTypes {
    public static final String CUSTOM = "custom";
    public static final String USER_SPECIFIED = "user-specified";
    public static final String USERNAME = "username";
    public static final String HIGH_ENTROPY = "high-entropy";

    private RedactionTypes() {}

    /** {@code [REDACTED:<type>]} */
    public static String placeholder(String type) {
        return "[REDACTED:" + type + "]";
    }
}
