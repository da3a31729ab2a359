package com.keygate.backend.modules.session.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.keygate.backend.modules.auth.application.port.SessionSaver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Hard-deletes sessions that can no longer be used and have been dead for longer than the
 * retention window, so revoked and expired rows do not accumulate.
 */
@Component
public class SessionPruningScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionPruningScheduler.class);

    private final SessionSaver sessionSaver;
    private final Clock clock;
    private final Duration retention;

    public SessionPruningScheduler(SessionSaver sessionSaver,
                                   Clock clock,
                                   @Value("${keygate.sessions.retention:P7D}") Duration retention) {
        this.sessionSaver = sessionSaver;
        this.clock = clock;
        this.retention = retention;
    }

    @Scheduled(fixedDelayString = "${keygate.sessions.prune-interval:PT1H}",
            initialDelayString = "${keygate.sessions.prune-interval:PT1H}")
    public void pruneExpiredSessions() {
        Instant cutoff = clock.instant().minus(retention);
        try {
            int deleted = sessionSaver.deleteExpiredBefore(cutoff);
            if (deleted > 0) {
                log.info("Pruned {} sessions dead since before {}", deleted, cutoff);
            }
        } catch (DataAccessException ex) {
            log.warn("Session pruning failed, retrying on next run", ex);
        }
    }
}
