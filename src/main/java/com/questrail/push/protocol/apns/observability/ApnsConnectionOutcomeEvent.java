package com.questrail.push.protocol.apns.observability;

import com.questrail.push.protocol.apns.internal.connection.ConnectionOutcome;

import java.time.Instant;

/**
 * Record representing the end of one connection incarnation.
 */
public record ApnsConnectionOutcomeEvent(
    Instant timestamp,
    String connection,
    ConnectionOutcome outcome
) {
}
