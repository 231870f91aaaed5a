/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.core.allow;

import java.util.Set;

/**
 * Decides whether a dotted-quad IPv4 address is known-safe and should be left in the text.
 *
 * <p>Allowed: loopback (127/8), unspecified (0.0.0.0), RFC 1918 private ranges (10/8, 172.16/12,
 * 192.168/16), link-local (169.254/16) and a few well-known public resolvers.
 * Anything that is not four numeric segments is not allowed.
 */
public final class IpAllowlist {
    private static final Set<String> PUBLIC_RESOLVERS = Set.of("8.8.8.8", "8.8.4.4", "1.1.1.1", "1.0.0.1");

    private IpAllowlist() {}

    public static boolean isAllowed(String ip) {
        if (ip == null || ip.isEmpty()) return false;
        String[] parts = ip.split("\\.", -1);
        if (parts.length != 4) return false;

        int[] o = new int[4];
        for (int i = 0; i < 4; i++) {
            Integer v = parseOctet(parts[i]);
            if (v == null) return false;
            o[i] = v;
        }
        int a = o[0], b = o[1], c = o[2], d = o[3];

        if (a == 127) return true; // loopback
        if (a == 0 && b == 0 && c == 0 && d == 0) return true; // unspecified
        if (a == 10) return true;
        if (a == 172 && b >= 16 && b <= 31) return true;
        if (a == 192 && b == 168) return true;
        if (a == 169 && b == 254) return true; // link-local
        return PUBLIC_RESOLVERS.contains(ip);
    }

    /** Digits only; out-of-range values still parse so that e.g. 999.1.1.1 is simply "not allowed". */
    private static Integer parseOctet(String s) {
        if (s.isEmpty() || s.length() > 9) return null;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch < '0' || ch > '9') return null;
        }
        return Integer.parseInt(s);
    }
}
