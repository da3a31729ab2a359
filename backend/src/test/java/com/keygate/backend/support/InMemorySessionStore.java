package com.keygate.backend.support;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.keygate.backend.global.common.CallContext;
import com.keygate.backend.modules.auth.application.port.SessionProvider;
import com.keygate.backend.modules.auth.application.port.SessionSaver;
import com.keygate.backend.modules.session.domain.NewSession;
import com.keygate.backend.modules.session.domain.RevocationReason;
import com.keygate.backend.modules.session.domain.Session;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * Insertion-ordered session store with the same visibility rules as the JPA store.
 */
public class InMemorySessionStore implements SessionSaver, SessionProvider {

    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final List<String> revokedTokens = new ArrayList<>();
    private final Clock clock;

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized String saveSession(CallContext ctx, NewSession session) {
        ctx.throwIfCancelled("InMemorySessionStore.saveSession");
        boolean duplicate = sessions.values().stream()
                .anyMatch(s -> s.token().equals(session.token()) || s.refreshToken().equals(session.refreshToken()));
        if (duplicate) {
            throw new DataIntegrityViolationException("duplicate token");
        }
        String id = UUID.randomUUID().toString();
        sessions.put(id, new Session(id, session.accountId(), session.userAgent(), session.ipAddress(),
                session.token(), session.refreshToken(), session.expiresAt(), session.refreshExpiresAt(), null));
        return id;
    }

    @Override
    public synchronized void revokeSession(CallContext ctx, String token, RevocationReason reason) {
        ctx.throwIfCancelled("InMemorySessionStore.revokeSession");
        revokedTokens.add(token);
        sessions.replaceAll((id, s) -> s.token().equals(token) && !s.isRevoked()
                ? new Session(s.id(), s.accountId(), s.userAgent(), s.ipAddress(), s.token(), s.refreshToken(),
                        s.expiresAt(), s.refreshExpiresAt(), clock.instant())
                : s);
    }

    @Override
    public synchronized int deleteExpiredBefore(Instant cutoff) {
        int before = sessions.size();
        sessions.values().removeIf(s -> s.refreshExpiresAt().isBefore(cutoff)
                || (s.isRevoked() && s.revokedAt().isBefore(cutoff)));
        return before - sessions.size();
    }

    @Override
    public synchronized List<Session> sessions(CallContext ctx, long accountId) {
        ctx.throwIfCancelled("InMemorySessionStore.sessions");
        Instant now = clock.instant();
        return sessions.values().stream()
                .filter(s -> s.accountId() == accountId && s.isRefreshable(now))
                .toList();
    }

    @Override
    public synchronized Optional<Session> session(CallContext ctx, String token) {
        ctx.throwIfCancelled("InMemorySessionStore.session");
        return sessions.values().stream()
                .filter(s -> s.token().equals(token) && !s.isRevoked())
                .findFirst();
    }

    @Override
    public synchronized Optional<Session> sessionByRefreshToken(CallContext ctx, String refreshToken) {
        ctx.throwIfCancelled("InMemorySessionStore.sessionByRefreshToken");
        return sessions.values().stream()
                .filter(s -> s.refreshToken().equals(refreshToken) && !s.isRevoked())
                .findFirst();
    }

    public synchronized List<String> revokedTokens() {
        return List.copyOf(revokedTokens);
    }

    public synchronized int size() {
        return sessions.size();
    }
}
