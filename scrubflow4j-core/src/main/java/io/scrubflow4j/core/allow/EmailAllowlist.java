/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.allow;

import java.util.Locale;
import java.util.Set;

/** Known example/test domains and bot/service domains whose addresses are not personal data. */
public final class EmailAllowlist {

    private static final Set<String> DOMAINS = Set.of(
            "example.com",
            "example.org",
            "example.net",
            "example.io",
            "test.com",
            "test.org",
            "localhost.com",
            // bots and services
            "github.com",
            "dependabot.com",
            "users.noreply.github.com",
            "noreply.github.com",
            "renovatebot.com",
            "snyk.io");

    private EmailAllowlist() {}

    /** Case-insensitive match on the substring after the last {@code @}. */
    public static boolean isAllowed(String email) {
        if (email == null) return false;
        int at = email.lastIndexOf('@');
        if (at < 0) return false;
        return DOMAINS.contains(email.substring(at + 1).toLowerCase(Locale.ROOT));
    }

    public static Set<String> domains() {
        return DOMAINS;
    }
}
