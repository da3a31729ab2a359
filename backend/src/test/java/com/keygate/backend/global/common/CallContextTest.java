package com.keygate.backend.global.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;

import com.keygate.backend.support.MutableClock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CallContextTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    @DisplayName("a background context stays live until cancelled")
    void backgroundUntilCancelled() {
        CallContext ctx = CallContext.background();

        assertThat(ctx.isCancelled()).isFalse();
        assertThat(ctx.deadline()).isEmpty();
        assertThatCode(() -> ctx.throwIfCancelled("op")).doesNotThrowAnyException();

        ctx.cancel();

        assertThat(ctx.isCancelled()).isTrue();
        assertThatThrownBy(() -> ctx.throwIfCancelled("Auth.Login"))
                .isInstanceOf(CallCancelledException.class)
                .hasMessage("Auth.Login: call cancelled");
    }

    @Test
    @DisplayName("a context expires when its deadline is reached")
    void deadline() {
        MutableClock clock = new MutableClock(START);
        CallContext ctx = CallContext.withTimeout(clock, Duration.ofSeconds(10));

        assertThat(ctx.deadline()).contains(START.plusSeconds(10));
        clock.advance(Duration.ofSeconds(9));
        assertThat(ctx.isCancelled()).isFalse();

        clock.advance(Duration.ofSeconds(1));

        assertThat(ctx.isCancelled()).isTrue();
        assertThatThrownBy(() -> ctx.throwIfCancelled("Auth.Logout"))
                .isInstanceOfSatisfying(CallCancelledException.class,
                        ex -> assertThat(ex.getOperation()).isEqualTo("Auth.Logout"))
                .hasMessageContaining("deadline exceeded");
    }

    @Test
    @DisplayName("timeouts must be positive")
    void nonPositiveTimeout() {
        MutableClock clock = new MutableClock(START);

        assertThatThrownBy(() -> CallContext.withTimeout(clock, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CallContext.withTimeout(clock, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("an interrupted thread counts as cancelled")
    void interruptedThread() {
        CallContext ctx = CallContext.background();
        Thread.currentThread().interrupt();
        try {
            assertThat(ctx.isCancelled()).isTrue();
        } finally {
            // clear the flag for the following tests
            Thread.interrupted();
        }
    }
}
