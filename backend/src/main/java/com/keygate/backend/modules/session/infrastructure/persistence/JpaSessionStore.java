package com.keygate.backend.modules.session.infrastructure.persistence;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.auth.application.port.SessionProvider;
import com.keygate.backend.modules.auth.application.port.SessionSaver;
import com.keygate.backend.modules.session.domain.NewSession;
import com.keygate.backend.modules.session.domain.RevocationReason;
import com.keygate.backend.modules.session.domain.Session;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session store on PostgreSQL. Revocation is a soft delete through {@code revoked_at};
 * revoked rows stay until {@link #deleteExpiredBefore(Instant)} removes them.
 */
@Component
public class JpaSessionStore implements SessionSaver, SessionProvider {

    private final AccountSessionRepository sessionRepository;
    private final Clock clock;

    public JpaSessionStore(AccountSessionRepository sessionRepository, Clock clock) {
        this.sessionRepository = sessionRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public String saveSession(CallContext ctx, NewSession session) {
        ctx.throwIfCancelled("SessionStore.saveSession");
        AccountSessionEntity entity = new AccountSessionEntity();
        entity.setAccountId(session.accountId());
        entity.setUserAgent(truncate(session.userAgent(), AccountSessionEntity.USER_AGENT_MAX_LENGTH));
        entity.setIpAddress(truncate(session.ipAddress(), AccountSessionEntity.IP_ADDRESS_MAX_LENGTH));
        entity.setToken(session.token());
        entity.setRefreshToken(session.refreshToken());
        entity.setExpiresAt(toOffset(session.expiresAt()));
        entity.setRefreshExpiresAt(toOffset(session.refreshExpiresAt()));
        return sessionRepository.saveAndFlush(entity).getId().toString();
    }

    @Override
    @Transactional
    public void revokeSession(CallContext ctx, String token, RevocationReason reason) {
        ctx.throwIfCancelled("SessionStore.revokeSession");
        sessionRepository.revokeByToken(token, OffsetDateTime.now(clock.withZone(ZoneOffset.UTC)), reason);
    }

    @Override
    @Transactional
    public int deleteExpiredBefore(Instant cutoff) {
        return sessionRepository.deleteExpiredBefore(toOffset(cutoff));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Session> sessions(CallContext ctx, long accountId) {
        ctx.throwIfCancelled("SessionStore.sessions");
        OffsetDateTime now = OffsetDateTime.now(clock.withZone(ZoneOffset.UTC));
        return sessionRepository.findLiveByAccountId(accountId, now).stream()
                .map(AccountSessionEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> session(CallContext ctx, String token) {
        ctx.throwIfCancelled("SessionStore.session");
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return sessionRepository.findActiveByToken(token).map(AccountSessionEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> sessionByRefreshToken(CallContext ctx, String refreshToken) {
        ctx.throwIfCancelled("SessionStore.sessionByRefreshToken");
        if (refreshToken == null || refreshToken.isBlank()) {
            return Optional.empty();
        }
        return sessionRepository.findActiveByRefreshToken(refreshToken).map(AccountSessionEntity::toDomain);
    }

    // client metadata is advisory; an oversized header must not fail issuance
    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
