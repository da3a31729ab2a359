package com.keygate.backend.modules.auth.infrastructure.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import com.keygate.backend.modules.auth.application.port.CredentialHashingException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class BCryptCredentialHasherTest {

    private final BCryptCredentialHasher hasher = new BCryptCredentialHasher(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("hashes verify against the original password only")
    void hashAndVerify() {
        byte[] hash = hasher.hash("pw123");

        assertThat(new String(hash, StandardCharsets.UTF_8)).startsWith("$2a$04$");
        assertThat(hasher.verify(hash, "pw123")).isTrue();
        assertThat(hasher.verify(hash, "pw124")).isFalse();
    }

    @Test
    @DisplayName("hashing is salted")
    void salted() {
        assertThat(hasher.hash("same")).isNotEqualTo(hasher.hash("same"));
    }

    @Test
    @DisplayName("72 bytes is the longest accepted password")
    void lengthLimit() {
        assertThat(hasher.verify(hasher.hash("a".repeat(72)), "a".repeat(72))).isTrue();
        assertThatThrownBy(() -> hasher.hash("a".repeat(73)))
                .isInstanceOf(CredentialHashingException.class);
        // multi-byte characters count by their UTF-8 length
        assertThatThrownBy(() -> hasher.hash("é".repeat(37)))
                .isInstanceOf(CredentialHashingException.class);
    }

    @Test
    @DisplayName("an empty stored hash cannot be verified")
    void emptyHash() {
        assertThatThrownBy(() -> hasher.verify(new byte[0], "pw"))
                .isInstanceOf(CredentialHashingException.class);
    }

    @Test
    @DisplayName("a stored value that is not a bcrypt hash never matches")
    void malformedHash() {
        assertThat(hasher.verify("not-a-bcrypt-hash".getBytes(StandardCharsets.UTF_8), "pw")).isFalse();
    }
}
