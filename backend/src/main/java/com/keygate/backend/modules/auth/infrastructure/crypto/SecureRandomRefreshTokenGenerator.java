package com.keygate.backend.modules.auth.infrastructure.crypto;

import java.security.SecureRandom;
import java.util.Base64;

import com.keygate.backend.modules.auth.application.port.RefreshTokenGenerator;
import com.keygate.backend.modules.auth.application.port.TokenGenerationException;

import org.springframework.stereotype.Component;

/**
 * 32 random bytes, URL-safe Base64 with padding (44 characters).
 */
@Component
public class SecureRandomRefreshTokenGenerator implements RefreshTokenGenerator {

    static final int TOKEN_BYTES = 32;

    private final SecureRandom random;

    public SecureRandomRefreshTokenGenerator() {
        this(new SecureRandom());
    }

    SecureRandomRefreshTokenGenerator(SecureRandom random) {
        this.random = random;
    }

    @Override
    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException ex) {
            throw new TokenGenerationException("failed to generate refresh token", ex);
        }
        return Base64.getUrlEncoder().encodeToString(bytes);
    }
}
