package com.questrail.push.protocol.apns.observability;

import com.questrail.push.protocol.apns.internal.connection.ConnectionState;

import java.time.Instant;

/**
 * Record representing a state transition of one gateway connection.
 */
public record ApnsStateTransitionEvent(
    Instant timestamp,
    String connection,
    ConnectionState oldState,
    ConnectionState newState
) {
}
