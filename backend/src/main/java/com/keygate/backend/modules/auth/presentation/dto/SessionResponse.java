package com.keygate.backend.modules.auth.presentation.dto;

import java.time.Instant;

import com.keygate.backend.modules.session.domain.Session;

/**
 * Session metadata without the token strings.
 */
public record SessionResponse(
        String sessionId,
        String userAgent,
        String ipAddress,
        Instant expiresAt,
        Instant refreshExpiresAt,
        boolean active
) {

    public static SessionResponse from(Session session, Instant now) {
        return new SessionResponse(
                session.id(),
                session.userAgent(),
                session.ipAddress(),
                session.expiresAt(),
                session.refreshExpiresAt(),
                session.isActive(now)
        );
    }
}
