package com.questrail.push.protocol.apns.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the push engine.
 */
public record ApnsErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
