package com.keygate.backend.modules.auth.application;

/**
 * @param expiresAt access expiry of the session, Unix seconds
 */
public record SessionValidity(boolean valid, long expiresAt) {
}
