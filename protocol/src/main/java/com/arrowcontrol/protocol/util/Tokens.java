package com.arrowcontrol.protocol.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public final class Tokens {

    private Tokens() {}

    /** Constant-time comparison; {@code null} never matches. */
    public static boolean matches(String expected, String candidate) {
        if (expected == null || candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }

    /** Log-safe rendering: first four characters only. */
    public static String mask(String token) {
        if (token == null || token.isEmpty()) {
            return "<none>";
        }
        return token.length() <= 4 ? "****" : token.substring(0, 4) + "****";
    }
}
