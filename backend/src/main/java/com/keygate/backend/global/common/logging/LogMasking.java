package com.keygate.backend.global.common.logging;

/**
 * Masks identifiers before they reach log output. Passwords, hashes and tokens are never
 * passed here; they are not logged at all.
 */
public final class LogMasking {

    private static final String MASK = "***";

    private LogMasking() {
    }

    /**
     * {@code alice@example.com} becomes {@code a***@example.com}.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return MASK;
        }
        String trimmed = email.trim();
        int at = trimmed.indexOf('@');
        if (at <= 0) {
            return trimmed.charAt(0) + MASK;
        }
        return trimmed.charAt(0) + MASK + trimmed.substring(at);
    }
}
