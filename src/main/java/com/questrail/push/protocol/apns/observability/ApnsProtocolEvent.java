package com.questrail.push.protocol.apns.observability;

import java.time.Instant;

/**
 * Record representing per-notification protocol activity.
 */
public record ApnsProtocolEvent(
    Instant timestamp,
    String connection,
    Kind kind,
    String detail
) {
    public enum Kind {
        SENT,
        REJECTED_LOCALLY,
        WINDOW_FULL,
        REPLAY_ENQUEUED
    }
}
