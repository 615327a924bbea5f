package com.questrail.push.protocol.apns.codec.impl;

import com.questrail.push.protocol.apns.codec.ApnsFrameEncoder;
import com.questrail.push.protocol.apns.codec.EncodeException;
import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.model.ProtocolError;

import java.nio.ByteBuffer;

import static com.questrail.push.protocol.apns.codec.impl.ApnsWireFormat.*;

/**
 * DefaultApnsFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ApnsFrameEncoder}.
 *
 * <p>The encoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Size validation of token and payload against the wire limits</li>
 *   <li>Item layout: token, payload, identifier, expiration, priority</li>
 *   <li>Frame header: command tag and total item length</li>
 * </ol>
 *
 * <p>Every item is always emitted. An expiration of {@code 0} is meaningful on
 * the wire ("do not store") and is therefore written rather than omitted.</p>
 */
public final class DefaultApnsFrameEncoder implements ApnsFrameEncoder
{
    @Override
    public byte[] encode(Notification notification)
    {
        final int tokenLength = notification.tokenLength();
        final int payloadLength = notification.payloadLength();

        if (tokenLength == 0) {
            throw new EncodeException(ProtocolError.MISSING_TOKEN, "device token is empty");
        }
        if (tokenLength > MAX_TOKEN_LENGTH) {
            throw new EncodeException(ProtocolError.INVALID_TOKEN_SIZE,
                    "device token is " + tokenLength + " bytes; limit is " + MAX_TOKEN_LENGTH);
        }
        if (payloadLength == 0) {
            throw new EncodeException(ProtocolError.MISSING_PAYLOAD, "payload is empty");
        }
        if (payloadLength > MAX_PAYLOAD_LENGTH) {
            throw new EncodeException(ProtocolError.INVALID_PAYLOAD_SIZE,
                    "payload is " + payloadLength + " bytes; limit is " + MAX_PAYLOAD_LENGTH);
        }

        final int itemsLength = ITEM_HEADER_LENGTH + tokenLength
                + ITEM_HEADER_LENGTH + payloadLength
                + ITEM_HEADER_LENGTH + 4
                + ITEM_HEADER_LENGTH + 4
                + ITEM_HEADER_LENGTH + 1;
        final int frameLength = FRAME_HEADER_LENGTH + itemsLength;

        if (frameLength > MAX_FRAME_LENGTH) {
            throw new EncodeException(ProtocolError.INVALID_PAYLOAD_SIZE,
                    "frame is " + frameLength + " bytes; limit is " + MAX_FRAME_LENGTH);
        }

        ByteBuffer buf = ByteBuffer.allocate(frameLength);
        buf.put((byte) COMMAND_NOTIFICATION);
        buf.putInt(itemsLength);

        putItem(buf, ITEM_DEVICE_TOKEN, notification.token());
        putItem(buf, ITEM_PAYLOAD, notification.payload());

        buf.put((byte) ITEM_IDENTIFIER).putShort((short) 4).putInt(notification.identifier());
        buf.put((byte) ITEM_EXPIRATION).putShort((short) 4).putInt((int) notification.expiration());
        buf.put((byte) ITEM_PRIORITY).putShort((short) 1).put((byte) notification.priority().wireValue());

        return buf.array();
    }

    private static void putItem(ByteBuffer buf, int itemId, byte[] data)
    {
        buf.put((byte) itemId);
        buf.putShort((short) data.length);
        buf.put(data);
    }
}
