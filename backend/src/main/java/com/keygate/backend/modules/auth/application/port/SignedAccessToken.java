package com.keygate.backend.modules.auth.application.port;

import java.time.Instant;

public record SignedAccessToken(String token, Instant issuedAt, Instant expiresAt) {

    @Override
    public String toString() {
        return "SignedAccessToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
