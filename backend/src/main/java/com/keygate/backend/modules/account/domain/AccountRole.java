package com.keygate.backend.modules.account.domain;

public enum AccountRole {
    STANDARD,
    ADMIN;

    public boolean isAdmin() {
        return this == ADMIN;
    }
}
