package com.questrail.push.protocol.apns.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to stamp notifications when they are enqueued.
 *
 * <p>This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for grace periods, backoff or shutdown deadlines.</p>
 */
public interface WallClock
{
    Instant now();
}
