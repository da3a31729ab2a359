package com.keygate.backend.modules.session.domain;

import java.time.Instant;

/**
 * One issued credential pair.
 * <p>
 * Active while {@code now < expiresAt}, refreshable while {@code now < refreshExpiresAt}.
 * A revoked session is never returned by store lookups; {@code revokedAt} is only set on
 * records read back for auditing.
 */
public record Session(
        String id,
        long accountId,
        String userAgent,
        String ipAddress,
        String token,
        String refreshToken,
        Instant expiresAt,
        Instant refreshExpiresAt,
        Instant revokedAt
) {

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isActive(Instant now) {
        return !isRevoked() && now.isBefore(expiresAt);
    }

    public boolean isRefreshable(Instant now) {
        return !isRevoked() && now.isBefore(refreshExpiresAt);
    }

    @Override
    public String toString() {
        return "Session[id=" + id + ", accountId=" + accountId + ", expiresAt=" + expiresAt
                + ", refreshExpiresAt=" + refreshExpiresAt + ", revokedAt=" + revokedAt + "]";
    }
}
