package com.keygate.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

public enum AuthErrorKind {
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "invalid credentials"),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND, "auth.account_not_found", "account not found"),
    APP_NOT_FOUND(HttpStatus.NOT_FOUND, "auth.app_not_found", "app not found"),
    SESSION_NOT_FOUND(HttpStatus.UNAUTHORIZED, "auth.session_not_found", "session not found"),
    SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "auth.session_expired", "session expired"),
    REFRESH_TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "auth.refresh_token_expired", "refresh token expired"),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "auth.permission_denied", "permission denied"),
    HASHING_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "auth.hashing_failure", "credential hashing failed"),
    TOKEN_GENERATION_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "auth.token_generation_failure", "token generation failed"),
    PERSISTENCE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "auth.persistence_failure", "persistence failure"),
    CANCELLED(HttpStatus.SERVICE_UNAVAILABLE, "auth.cancelled", "operation cancelled");

    private final HttpStatus status;
    private final String code;
    private final String description;

    AuthErrorKind(HttpStatus status, String code, String description) {
        this.status = status;
        this.code = code;
        this.description = description;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
