package com.questrail.push.protocol.apns.internal.connection;

import com.questrail.push.protocol.apns.config.ApnsEndpoint;

/**
 * A gateway connection could not be established (TCP connect, TLS handshake,
 * or timeout). Always transient from the connection's point of view; whether
 * to give up is the backend's decision.
 */
public final class ApnsConnectException extends Exception
{
    private final ApnsEndpoint remote;

    public ApnsConnectException(ApnsEndpoint remote, String message, Throwable cause)
    {
        super(message + ": " + remote, cause);
        this.remote = remote;
    }

    public ApnsEndpoint remote()
    {
        return remote;
    }
}
