package com.questrail.push.protocol.apns.codec;

import com.questrail.push.protocol.apns.model.Notification;

/**
 * ApnsFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for outbound notification frames.
 *
 * <p>This interface defines the outbound boundary between a {@link Notification}
 * and the bytes written to the gateway connection. Implementations are pure:
 * no I/O, no state, and identical input always yields identical output.</p>
 *
 * <p>The encoder is also the place where size limits that the gateway would
 * otherwise report asynchronously are detected locally. A notification that
 * cannot be encoded never reaches the transport.</p>
 */
public interface ApnsFrameEncoder
{
    /**
     * Encode a notification as a complete item-framed record.
     *
     * @param notification the notification to encode
     * @return the frame, ready to be written to the socket
     * @throws EncodeException if a wire size limit would be violated
     */
    byte[] encode(Notification notification);
}
