package com.keygate.backend.global.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation handle passed through every auth operation and every store call.
 * <p>
 * A context is cancelled when {@link #cancel()} was called, when its deadline has passed,
 * or when the calling thread has been interrupted. It never carries its own timeout logic;
 * the transport decides the deadline.
 */
public final class CallContext {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CallContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Context without a deadline; only {@link #cancel()} or thread interruption end it.
     */
    public static CallContext background() {
        return new CallContext(Clock.systemUTC(), null);
    }

    public static CallContext withDeadline(Clock clock, Instant deadline) {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(deadline, "deadline");
        return new CallContext(clock, deadline);
    }

    public static CallContext withTimeout(Clock clock, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return withDeadline(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isCancelled() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * @param operation name of the operation about to run, carried into the exception
     * @throws CallCancelledException if the context is no longer live
     */
    public void throwIfCancelled(String operation) {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new CallCancelledException(operation, "call cancelled");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new CallCancelledException(operation, "deadline exceeded at " + deadline);
        }
    }
}
