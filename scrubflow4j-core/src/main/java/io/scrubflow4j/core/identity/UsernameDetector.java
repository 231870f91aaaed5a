/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the set of identifiers to anonymize for one export.
 *
 * <p>Order of candidates: OS account name, home directory, then (only when a working directory is
 * given) {@code git config user.name}, the local part of {@code git config user.email} and the
 * forge handle of the {@code origin} remote, then caller-supplied extras. Values are trimmed, blank
 * ones dropped, duplicates removed keeping the first occurrence.
 *
 * <p>The result depends on the current environment and is computed fresh on every call.
 */
public final class UsernameDetector {
    private final IdentityProvider identity;
    private final GitConfigReader git;
    private final String forgeHost;

    public UsernameDetector(IdentityProvider identity, GitConfigReader git, String forgeHost) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.git = Objects.requireNonNull(git, "git");
        this.forgeHost = Objects.requireNonNull(forgeHost, "forgeHost");
    }

    public List<String> detect(Path workingDirectory, List<String> extra) {
        List<String> candidates = new ArrayList<>();
        OperatorIdentity op = identity.current();
        candidates.add(op.username());
        candidates.add(op.homeDirectory());

        if (workingDirectory != null) {
            git.userName(workingDirectory).ifPresent(candidates::add);
            git.userEmail(workingDirectory).map(UsernameDetector::localPart).ifPresent(candidates::add);
            git.originUrl(workingDirectory)
                    .flatMap(url -> ForgeHandles.extract(url, forgeHost))
                    .ifPresent(candidates::add);
        }
        if (extra != null) candidates.addAll(extra);

        return dedupe(candidates);
    }

    static List<String> dedupe(List<String> raw) {
        Set<String> seen = new LinkedHashSet<>();
        for (String s : raw) {
            if (s == null) continue;
            String t = s.trim();
            if (!t.isEmpty()) seen.add(t);
        }
        return List.copyOf(seen);
    }

    private static String localPart(String email) {
        int at = email.indexOf('@');
        return at < 0 ? email : email.substring(0, at);
    }
}
