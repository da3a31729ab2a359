package com.keygate.backend.modules.auth.presentation.dto;

import com.keygate.backend.modules.auth.application.TokenPair;

/**
 * Expiry fields are Unix seconds.
 */
public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresAt,
        String refreshToken,
        long refreshExpiresAt
) {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair tokens) {
        return new TokenPairResponse(
                tokens.accessToken(),
                DEFAULT_TOKEN_TYPE,
                tokens.expiresAt().getEpochSecond(),
                tokens.refreshToken(),
                tokens.refreshExpiresAt().getEpochSecond()
        );
    }
}
