package com.questrail.push.protocol.apns.internal.connection;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one gateway connection.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → READY → DRAINING → DISCONNECTED
 *                      └──────── (connect failed) ───────┘
 * </pre>
 *
 * <p>A connection that reached {@code DISCONNECTED} after {@code DRAINING} is
 * finished; the backend creates a new one to reconnect.</p>
 */
public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    READY,
    DRAINING;

    private Set<ConnectionState> successors;

    static {
        DISCONNECTED.successors = EnumSet.of(CONNECTING);
        CONNECTING.successors = EnumSet.of(READY, DISCONNECTED);
        READY.successors = EnumSet.of(DRAINING);
        DRAINING.successors = EnumSet.of(DISCONNECTED);
    }

    public boolean canTransitionTo(ConnectionState next)
    {
        return successors.contains(next);
    }

    /** Whether the connection may still take notifications from the queue. */
    public boolean acceptsWork()
    {
        return this == READY;
    }
}
