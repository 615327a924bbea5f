package com.questrail.push.protocol.apns.codec;

import com.questrail.push.protocol.apns.model.ProtocolError;

import java.util.Objects;

/**
 * Indicates that a notification violates a wire limit and cannot be encoded.
 *
 * <p>The exception carries the {@link ProtocolError} that the gateway would
 * have reported for the same notification, so that callers can treat local
 * rejections and gateway rejections uniformly.</p>
 */
public final class EncodeException extends RuntimeException
{
    private final ProtocolError reason;

    public EncodeException(ProtocolError reason, String message)
    {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ProtocolError reason()
    {
        return reason;
    }
}
