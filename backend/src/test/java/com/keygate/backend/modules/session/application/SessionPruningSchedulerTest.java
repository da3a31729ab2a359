package com.keygate.backend.modules.session.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import com.keygate.backend.modules.auth.application.port.SessionSaver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class SessionPruningSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-01-10T00:00:00Z");

    @Mock
    private SessionSaver sessionSaver;

    private SessionPruningScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SessionPruningScheduler(sessionSaver, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofDays(7));
    }

    @Test
    @DisplayName("sessions dead for longer than the retention window are deleted")
    void prunesBeforeRetentionCutoff() {
        when(sessionSaver.deleteExpiredBefore(Instant.parse("2025-01-03T00:00:00Z"))).thenReturn(3);

        scheduler.pruneExpiredSessions();

        verify(sessionSaver).deleteExpiredBefore(Instant.parse("2025-01-03T00:00:00Z"));
    }

    @Test
    @DisplayName("a store failure does not escape the scheduled run")
    void storeFailureIsContained() {
        when(sessionSaver.deleteExpiredBefore(Instant.parse("2025-01-03T00:00:00Z")))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> scheduler.pruneExpiredSessions()).doesNotThrowAnyException();
    }
}
