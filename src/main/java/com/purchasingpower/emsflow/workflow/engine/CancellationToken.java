package com.purchasingpower.emsflow.workflow.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal for one request: an explicit cancel flag plus an optional deadline.
 * Safe to cancel from another thread; workflows poll it between steps.
 */
public final class CancellationToken {

    private final String requestId;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private CancellationToken(String requestId, Instant deadline, Clock clock) {
        this.requestId = requestId;
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken create(String requestId) {
        return new CancellationToken(requestId, null, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(String requestId, Duration timeout, Clock clock) {
        Instant deadline = timeout == null || timeout.isZero() || timeout.isNegative()
                ? null
                : clock.instant().plus(timeout);
        return new CancellationToken(requestId, deadline, clock);
    }

    public String getRequestId() {
        return requestId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || isExpired();
    }

    public String reason() {
        if (cancelled.get()) {
            return "cancelled by caller";
        }
        return isExpired() ? "deadline " + deadline + " exceeded" : "not cancelled";
    }

    private boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
