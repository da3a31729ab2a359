package com.keygate.backend.modules.auth.infrastructure.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashSet;
import java.util.Set;

import com.keygate.backend.modules.auth.application.port.TokenGenerationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SecureRandomRefreshTokenGeneratorTest {

    @Test
    @DisplayName("tokens are 32 random bytes in padded URL-safe base64")
    void format() {
        String token = new SecureRandomRefreshTokenGenerator().generate();

        assertThat(token).hasSize(44).endsWith("=").doesNotContain("+", "/");
        assertThat(Base64.getUrlDecoder().decode(token)).hasSize(32);
    }

    @Test
    @DisplayName("consecutive tokens do not repeat")
    void unique() {
        SecureRandomRefreshTokenGenerator generator = new SecureRandomRefreshTokenGenerator();
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            tokens.add(generator.generate());
        }

        assertThat(tokens).hasSize(1000);
    }

    @Test
    @DisplayName("a failing random source surfaces as a token generation failure")
    void randomSourceFailure() {
        SecureRandom broken = new SecureRandom() {
            @Override
            public void nextBytes(byte[] bytes) {
                throw new IllegalStateException("entropy source unavailable");
            }
        };

        assertThatThrownBy(() -> new SecureRandomRefreshTokenGenerator(broken).generate())
                .isInstanceOf(TokenGenerationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
