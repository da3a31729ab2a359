package com.keygate.backend.modules.account.domain;

public record NewAccount(String email, byte[] passHash, AccountRole role, AccountStatus status, long appId) {

    @Override
    public String toString() {
        return "NewAccount[role=" + role + ", status=" + status + ", appId=" + appId + "]";
    }
}
