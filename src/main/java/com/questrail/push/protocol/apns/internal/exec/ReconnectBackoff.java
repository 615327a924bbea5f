package com.questrail.push.protocol.apns.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential delay between consecutive failed connect attempts.
 *
 * <pre>
 *   attempt 1 → initial
 *   attempt n → min(initial · 2^(n-1), max)
 * </pre>
 *
 * <p>Stateless; the attempt count comes from {@link ConnectAttemptTracker}.</p>
 */
public final class ReconnectBackoff
{
    private final Duration initialDelay;
    private final Duration maxDelay;

    public ReconnectBackoff(Duration initialDelay, Duration maxDelay)
    {
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("require 0 <= initialDelay <= maxDelay");
        }
    }

    public static ReconnectBackoff from(ApnsTimingPolicy policy)
    {
        return new ReconnectBackoff(policy.reconnectInitialDelay(), policy.reconnectMaxDelay());
    }

    /**
     * Delay to wait before the next attempt.
     *
     * @param failedAttempts consecutive failures so far; values below 1 yield zero
     */
    public Duration delayFor(int failedAttempts)
    {
        if (failedAttempts < 1) {
            return Duration.ZERO;
        }

        final long initialNanos = initialDelay.toNanos();
        final long maxNanos = maxDelay.toNanos();

        // Shift saturates well before 2^62; anything beyond is capped anyway.
        final int shift = Math.min(failedAttempts - 1, 62);
        final long factor = 1L << shift;

        if (initialNanos != 0 && factor > maxNanos / initialNanos) {
            return maxDelay;
        }
        return Duration.ofNanos(Math.min(initialNanos * factor, maxNanos));
    }
}
