package com.questrail.push.protocol.apns.backend;

import com.questrail.push.protocol.apns.config.ApnsEndpoint;

/**
 * The gateway could not be reached after the configured number of
 * consecutive connect attempts.
 *
 * <p>Reported to the fatal handler once per outage. The backend keeps
 * retrying at its maximum backoff delay; queued notifications are kept.</p>
 */
public final class ApnsUnavailableException extends RuntimeException
{
    private final ApnsEndpoint remote;
    private final int attempts;

    public ApnsUnavailableException(ApnsEndpoint remote, int attempts, Throwable cause)
    {
        super("gateway " + remote + " unreachable after " + attempts + " attempts", cause);
        this.remote = remote;
        this.attempts = attempts;
    }

    public ApnsEndpoint remote()
    {
        return remote;
    }

    public int attempts()
    {
        return attempts;
    }
}
