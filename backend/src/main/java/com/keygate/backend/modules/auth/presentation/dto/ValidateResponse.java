package com.keygate.backend.modules.auth.presentation.dto;

import com.keygate.backend.modules.auth.application.SessionValidity;

public record ValidateResponse(boolean valid, long expiresAt) {

    public static ValidateResponse from(SessionValidity validity) {
        return new ValidateResponse(validity.valid(), validity.expiresAt());
    }
}
