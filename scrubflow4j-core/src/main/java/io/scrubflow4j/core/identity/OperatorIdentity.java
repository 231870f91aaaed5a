/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

/**
 * Who is running the export: OS account name and home directory. Either may be null when the
 * platform does not report it.
 */
public record OperatorIdentity(String username, String homeDirectory) {}
