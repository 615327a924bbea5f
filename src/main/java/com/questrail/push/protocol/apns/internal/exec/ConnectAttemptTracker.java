package com.questrail.push.protocol.apns.internal.exec;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operational connect-attempt tracker, shared by all connection slots.
 *
 * - Tracks consecutive failed connects per connection slot
 * - Resets on a successful connect
 * - Lets one slot claim the report of an outage; the claim is released when
 *   any slot connects again
 * - Does not encode backoff policy
 */
public final class ConnectAttemptTracker {

    private final ConcurrentMap<Integer, Integer> failures =
            new ConcurrentHashMap<>();

    private final AtomicBoolean outageReported = new AtomicBoolean(false);

    /**
     * Record that a connect attempt failed.
     *
     * @return the updated consecutive failure count
     */
    public int recordFailure(int slot) {
        return failures.merge(slot, 1, Integer::sum);
    }

    /**
     * Reset the failure count after a successful connect. The gateway is
     * reachable again, so a later outage may be reported anew.
     */
    public void reset(int slot) {
        failures.remove(slot);
        outageReported.set(false);
    }

    /**
     * Current consecutive failure count (0 if none).
     */
    public int failuresFor(int slot) {
        return failures.getOrDefault(slot, 0);
    }

    /**
     * @return {@code true} for exactly one caller per outage
     */
    public boolean claimOutageReport() {
        return outageReported.compareAndSet(false, true);
    }
}
