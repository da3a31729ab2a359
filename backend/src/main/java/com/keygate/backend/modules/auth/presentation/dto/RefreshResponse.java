package com.keygate.backend.modules.auth.presentation.dto;

import com.keygate.backend.modules.auth.application.RefreshedSession;

/**
 * {@code expiresAt} is the refresh expiry of the new session, in Unix seconds.
 */
public record RefreshResponse(String accessToken, String refreshToken, long expiresAt) {

    public static RefreshResponse from(RefreshedSession session) {
        return new RefreshResponse(session.accessToken(), session.refreshToken(), session.expiresAt());
    }
}
