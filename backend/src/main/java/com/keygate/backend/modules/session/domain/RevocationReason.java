package com.keygate.backend.modules.session.domain;

public enum RevocationReason {
    LOGOUT,
    REVOKED
}
