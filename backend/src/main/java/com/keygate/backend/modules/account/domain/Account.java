package com.keygate.backend.modules.account.domain;

import java.util.Objects;

/**
 * Registered identity as seen by the auth engine. Always a fresh read from the account store.
 */
public record Account(long id, String email, byte[] passHash, AccountRole role, AccountStatus status, long appId) {

    public Account {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(passHash, "passHash");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(status, "status");
    }

    public boolean isAdmin() {
        return role.isAdmin();
    }

    @Override
    public String toString() {
        return "Account[id=" + id + ", role=" + role + ", status=" + status + ", appId=" + appId + "]";
    }
}
