package com.keygate.backend.modules.auth.presentation.dto;

import com.keygate.backend.modules.account.domain.AccountRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * @param role defaults to {@link AccountRole#STANDARD} when omitted
 */
public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") String email,
        @NotBlank(message = "password is required") String password,
        AccountRole role,
        @NotNull(message = "appId is required") @Positive(message = "appId must be positive") Long appId
) {

    public AccountRole roleOrDefault() {
        return role != null ? role : AccountRole.STANDARD;
    }
}
