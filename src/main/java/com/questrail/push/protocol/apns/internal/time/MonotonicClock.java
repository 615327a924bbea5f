package com.questrail.push.protocol.apns.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational deadline in the engine.
 *
 * <h2>Binding invariant</h2>
 * Delivery grace, connect backoff and shutdown budgets MUST be measured with a
 * monotonic time source. Wall-clock time (e.g. {@code Instant.now()}) is
 * permitted only for diagnostics such as {@code Notification.enqueuedAt}.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
