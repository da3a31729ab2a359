package com.keygate.backend.modules.auth.presentation.dto;

import com.keygate.backend.modules.account.domain.AccountStatus;

public record ChangeStatusResponse(long accountId, AccountStatus status) {
}
