package com.keygate.backend.modules.session.domain;

import java.time.Instant;

public record NewSession(
        long accountId,
        String userAgent,
        String ipAddress,
        String token,
        String refreshToken,
        Instant expiresAt,
        Instant refreshExpiresAt
) {

    @Override
    public String toString() {
        return "NewSession[accountId=" + accountId + ", expiresAt=" + expiresAt
                + ", refreshExpiresAt=" + refreshExpiresAt + "]";
    }
}
