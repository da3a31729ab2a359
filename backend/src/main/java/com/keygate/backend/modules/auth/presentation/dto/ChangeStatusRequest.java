package com.keygate.backend.modules.auth.presentation.dto;

import com.keygate.backend.modules.account.domain.AccountStatus;

import jakarta.validation.constraints.NotNull;

public record ChangeStatusRequest(@NotNull(message = "status is required") AccountStatus status) {
}
