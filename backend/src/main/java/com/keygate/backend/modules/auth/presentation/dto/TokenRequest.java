package com.keygate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of the validate and revoke calls.
 */
public record TokenRequest(@NotBlank(message = "token is required") String token) {
}
