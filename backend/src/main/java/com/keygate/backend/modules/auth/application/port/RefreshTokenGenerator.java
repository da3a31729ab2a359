package com.keygate.backend.modules.auth.application.port;

public interface RefreshTokenGenerator {

    /**
     * @return opaque URL-safe token backed by cryptographically secure randomness
     * @throws TokenGenerationException if no randomness is available
     */
    String generate();
}
