/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

import java.nio.file.Path;
import java.util.Optional;

/** Read access to the version-control identity configured for a working directory. */
public interface GitConfigReader {

    /** {@code git config user.name} */
    Optional<String> userName(Path workingDirectory);

    /** {@code git config user.email} */
    Optional<String> userEmail(Path workingDirectory);

    /** {@code git remote get-url origin} */
    Optional<String> originUrl(Path workingDirectory);

    /** Reader that knows nothing; used when git lookups are switched off. */
    static GitConfigReader none() {
        return new GitConfigReader() {
            @Override
            public Optional<String> userName(Path workingDirectory) {
                return Optional.empty();
            }

            @Override
            public Optional<String> userEmail(Path workingDirectory) {
                return Optional.empty();
            }

            @Override
            public Optional<String> originUrl(Path workingDirectory) {
                return Optional.empty();
            }
        };
    }
}
