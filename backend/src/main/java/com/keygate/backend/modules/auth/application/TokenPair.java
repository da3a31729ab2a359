package com.keygate.backend.modules.auth.application;

import java.time.Instant;

public record TokenPair(String accessToken, String refreshToken, Instant expiresAt, Instant refreshExpiresAt) {

    @Override
    public String toString() {
        return "TokenPair[expiresAt=" + expiresAt + ", refreshExpiresAt=" + refreshExpiresAt + "]";
    }
}
