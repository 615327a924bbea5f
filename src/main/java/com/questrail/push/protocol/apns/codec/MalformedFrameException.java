package com.questrail.push.protocol.apns.codec;

/**
 * Indicates that inbound bytes do not form a valid frame.
 *
 * This typically reflects:
 * <ul>
 *   <li>An error frame of the wrong length</li>
 *   <li>An unexpected command tag</li>
 *   <li>A feedback record cut off by the end of the stream</li>
 * </ul>
 */
public final class MalformedFrameException extends RuntimeException
{
    public MalformedFrameException(String message) {
        super(message);
    }
}
