/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

/** Source of the operator identity. Queried on every redaction call, never cached by callers. */
@FunctionalInterface
public interface IdentityProvider {
    OperatorIdentity current();

    /** Constant identity, for tests and for hosts that already resolved the operator. */
    static IdentityProvider fixed(String username, String homeDirectory) {
        OperatorIdentity id = new OperatorIdentity(username, homeDirectory);
        return () -> id;
    }

    /** Contributes nothing to username anonymization. */
    static IdentityProvider none() {
        return fixed(null, null);
    }
}
