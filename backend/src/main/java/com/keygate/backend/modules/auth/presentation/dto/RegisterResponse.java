package com.keygate.backend.modules.auth.presentation.dto;

public record RegisterResponse(long accountId) {
}
