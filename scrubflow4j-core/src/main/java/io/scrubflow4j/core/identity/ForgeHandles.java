/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.identity;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the account handle from a git remote URL hosted on a given forge.
 *
 * <p>Supported forms, for host {@code github.com}:
 * <ul>
 *   <li>{@code https://github.com/HANDLE/repo(.git)} (optionally with {@code user@} userinfo)</li>
 *   <li>{@code ssh://git@github.com/HANDLE/repo}</li>
 *   <li>{@code git@github.com:HANDLE/repo}</li>
 * </ul>
 * The host must match exactly; {@code notgithub.com} or {@code github.com.evil.io} yield nothing.
 */
public final class ForgeHandles {
    public static final String DEFAULT_HOST = "github.com";

    private ForgeHandles() {}

    public static Optional<String> extract(String remoteUrl, String host) {
        if (remoteUrl == null || remoteUrl.isBlank() || host == null || host.isBlank()) return Optional.empty();
        String h = Pattern.quote(host.trim());
        String url = remoteUrl.trim();

        Matcher https = Pattern.compile("(?i)^(?:https?|ssh|git)://(?:[^@/\\s]+@)?" + h + "(?::\\d+)?/([^/\\s]+)/")
                .matcher(url);
        if (https.find()) return nonBlank(https.group(1));

        Matcher scp = Pattern.compile("(?i)^[^@/\\s:]+@" + h + ":([^/\\s]+)/").matcher(url);
        if (scp.find()) return nonBlank(scp.group(1));

        return Optional.empty();
    }

    private static Optional<String> nonBlank(String s) {
        return (s == null || s.isBlank()) ? Optional.empty() : Optional.of(s);
    }
}
