package com.keygate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ChangePasswordRequest(
        @NotNull(message = "accountId is required") Long accountId,
        @NotBlank(message = "oldPassword is required") String oldPassword,
        @NotBlank(message = "newPassword is required") String newPassword
) {
}
