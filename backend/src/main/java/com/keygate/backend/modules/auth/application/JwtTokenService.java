package com.keygate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

import com.keygate.backend.modules.account.domain.Account;
import com.keygate.backend.modules.app.domain.App;
import com.keygate.backend.modules.auth.application.port.SignedAccessToken;
import com.keygate.backend.modules.auth.application.port.TokenGenerationException;
import com.keygate.backend.modules.auth.application.port.TokenSigner;
import com.keygate.backend.modules.auth.infrastructure.jwt.AppSigningKeys;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

/**
 * Signs HS256 access tokens with the secret of the app they are issued for. The header
 * {@code kid} carries the app id.
 */
@Service
public class JwtTokenService implements TokenSigner {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_APP_ID = "app_id";
    static final String CLAIM_ROLE = "role";

    private final AppSigningKeys signingKeys;
    private final Clock clock;

    public JwtTokenService(AppSigningKeys signingKeys, Clock clock) {
        this.signingKeys = signingKeys;
        this.clock = clock;
    }

    @Override
    public SignedAccessToken sign(Account account, App app, Duration ttl) {
        // JWT timestamps have second precision
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);

        try {
            SecretKey key = signingKeys.keyFor(app);
            String token = Jwts.builder()
                    .header().keyId(Long.toString(app.id())).and()
                    .id(UUID.randomUUID().toString())
                    .subject(Long.toString(account.id()))
                    .issuedAt(Date.from(issuedAt))
                    .expiration(Date.from(expiresAt))
                    .claim(CLAIM_EMAIL, account.email())
                    .claim(CLAIM_APP_ID, app.id())
                    .claim(CLAIM_ROLE, account.role().name())
                    .signWith(key, SIG.HS256)
                    .compact();
            return new SignedAccessToken(token, issuedAt, expiresAt);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenGenerationException("failed to sign access token for app " + app.id(), e);
        }
    }
}
