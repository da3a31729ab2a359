package com.keygate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.keygate.backend.modules.app.domain.App;

import org.springframework.stereotype.Component;

/**
 * Derives the HMAC key an app's access tokens are signed with from its stored secret.
 * The key is always the UTF-8 bytes of the secret, never a decoded form of it, so client
 * apps verify with exactly the string they were given.
 */
@Component
public class AppSigningKeys {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    public SecretKey keyFor(App app) {
        String secret = app.secret();
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("app " + app.id() + " has no signing secret");
        }
        return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    }
}
