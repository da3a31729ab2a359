package com.keygate.backend.modules.auth.infrastructure.crypto;

import java.nio.charset.StandardCharsets;

import com.keygate.backend.modules.auth.application.port.CredentialHasher;
import com.keygate.backend.modules.auth.application.port.CredentialHashingException;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt-backed {@link CredentialHasher}. The encoded hash string is stored as its UTF-8 bytes.
 */
@Component
public class BCryptCredentialHasher implements CredentialHasher {

    static final int MAX_PASSWORD_BYTES = 72;

    private final PasswordEncoder passwordEncoder;

    public BCryptCredentialHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public byte[] hash(String password) {
        if (password == null) {
            throw new CredentialHashingException("password must not be null");
        }
        // bcrypt ignores everything past 72 bytes
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw new CredentialHashingException("password exceeds " + MAX_PASSWORD_BYTES + " bytes");
        }
        try {
            return passwordEncoder.encode(password).getBytes(StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new CredentialHashingException("failed to hash password", ex);
        }
    }

    @Override
    public boolean verify(byte[] passHash, String password) {
        if (passHash == null || passHash.length == 0) {
            throw new CredentialHashingException("stored hash is empty");
        }
        if (password == null) {
            return false;
        }
        try {
            return passwordEncoder.matches(password, new String(passHash, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException ex) {
            throw new CredentialHashingException("failed to verify password", ex);
        }
    }
}
