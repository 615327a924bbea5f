package com.questrail.push.protocol.apns.observability;

import com.questrail.push.protocol.apns.config.ApnsEndpoint;

import java.time.Instant;

/**
 * Record representing a transport-level event (connect success or failure).
 */
public record ApnsTransportEvent(
    Instant timestamp,
    String connection,
    Kind kind,
    ApnsEndpoint remote,
    int consecutiveFailures,
    Throwable cause
) {
    public enum Kind {
        CONNECTED,
        CONNECT_FAILED
    }
}
