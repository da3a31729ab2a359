package com.keygate.backend.modules.auth.application;

/**
 * @param expiresAt refresh expiry of the new session, Unix seconds
 */
public record RefreshedSession(String accessToken, String refreshToken, long expiresAt) {

    @Override
    public String toString() {
        return "RefreshedSession[expiresAt=" + expiresAt + "]";
    }
}
