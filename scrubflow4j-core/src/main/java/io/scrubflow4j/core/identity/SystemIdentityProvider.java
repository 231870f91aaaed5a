/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

/** Reads {@code user.name} and {@code user.home} from the running JVM on each call. */
public final class SystemIdentityProvider implements IdentityProvider {

    @Override
    public OperatorIdentity current() {
        return new OperatorIdentity(System.getProperty("user.name"), System.getProperty("user.home"));
    }
}
