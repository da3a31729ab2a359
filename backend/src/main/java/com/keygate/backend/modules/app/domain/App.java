package com.keygate.backend.modules.app.domain;

import java.time.Duration;

/**
 * Registered client application. Read-only to the auth engine.
 * <p>
 * {@code tokenTtl} and {@code refreshTokenTtl} are stored registration data only; session
 * lifetimes always come from the service configuration.
 */
public record App(long id, String name, String secret, Duration tokenTtl, Duration refreshTokenTtl, String redirectUrl) {

    @Override
    public String toString() {
        return "App[id=" + id + ", name=" + name + "]";
    }
}
