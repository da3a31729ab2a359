package com.keygate.backend.modules.auth.presentation;

import java.util.Optional;

import com.keygate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;

final class BearerTokens {

    private static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    static Optional<String> find(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)) {
            return Optional.empty();
        }
        String header = authorizationHeader.trim();
        if (!header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return Optional.empty();
        }
        String token = header.substring(PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    static String require(String authorizationHeader) {
        return find(authorizationHeader)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.bearer_token_required",
                        "a bearer access token is required"));
    }
}
