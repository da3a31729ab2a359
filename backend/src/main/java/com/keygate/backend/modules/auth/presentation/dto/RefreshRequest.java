package com.keygate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RefreshRequest(
        @NotNull(message = "accountId is required") Long accountId,
        @NotBlank(message = "refreshToken is required") String refreshToken
) {
}
