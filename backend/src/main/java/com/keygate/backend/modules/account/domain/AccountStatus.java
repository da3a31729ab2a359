package com.keygate.backend.modules.account.domain;

public enum AccountStatus {
    ACTIVE,
    SUSPENDED,
    DEACTIVATED;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
