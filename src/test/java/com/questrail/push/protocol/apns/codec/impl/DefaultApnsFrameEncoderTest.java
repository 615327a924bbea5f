package com.questrail.push.protocol.apns.codec.impl;

import com.questrail.push.protocol.apns.codec.ApnsFrameEncoder;
import com.questrail.push.protocol.apns.codec.EncodeException;
import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.model.Priority;
import com.questrail.push.protocol.apns.model.ProtocolError;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultApnsFrameEncoderTest
{
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final ApnsFrameEncoder encoder = new DefaultApnsFrameEncoder();

    private static Notification notification(int id, byte[] token, byte[] payload, long expiration, Priority priority)
    {
        return new Notification(id, token, payload, expiration, priority, NOW);
    }

    @Test
    void encodesItemsInFixedOrder()
    {
        Notification n = notification(
                0x01020304,
                new byte[] { 0x01, 0x02 },
                new byte[] { '{', '}' },
                0L,
                Priority.IMMEDIATE);

        byte[] frame = encoder.encode(n);

        assertArrayEquals(new byte[] {
                0x02, 0x00, 0x00, 0x00, 0x1C,
                0x01, 0x00, 0x02, 0x01, 0x02,
                0x02, 0x00, 0x02, '{', '}',
                0x03, 0x00, 0x04, 0x01, 0x02, 0x03, 0x04,
                0x04, 0x00, 0x04, 0x00, 0x00, 0x00, 0x00,
                0x05, 0x00, 0x01, 0x0A
        }, frame);
    }

    @Test
    void frameLengthCountsItemsOnly()
    {
        byte[] frame = encoder.encode(notification(7, new byte[32], new byte[100], 0L, Priority.IMMEDIATE));

        int declared = ByteBuffer.wrap(frame).getInt(1);
        assertEquals(frame.length - 5, declared);
        assertEquals(3 + 32 + 3 + 100 + 7 + 7 + 4, declared);
    }

    @Test
    void expirationIsWrittenAsUnsigned32Bit()
    {
        byte[] frame = encoder.encode(notification(
                1, new byte[] { 0x01, 0x02 }, new byte[] { '{', '}' },
                Notification.MAX_EXPIRATION, Priority.CONSERVE_POWER));

        ByteBuffer buf = ByteBuffer.wrap(frame);
        assertEquals(4, buf.get(22));
        assertEquals(0xFFFF_FFFFL, Integer.toUnsignedLong(buf.getInt(25)));
        assertEquals(5, buf.get(frame.length - 1));
    }

    @Test
    void negativeIdentifierIsWrittenBitForBit()
    {
        byte[] frame = encoder.encode(notification(
                -1, new byte[] { 0x01 }, new byte[] { '{', '}' }, 0L, Priority.IMMEDIATE));

        assertEquals(-1, ByteBuffer.wrap(frame).getInt(4 + 1 + 4 + 5 + 3));
    }

    @Test
    void largestTokenAndPayloadAreAccepted()
    {
        byte[] frame = encoder.encode(notification(
                1, new byte[255], new byte[2048], 0L, Priority.IMMEDIATE));

        assertEquals(5 + 3 + 255 + 3 + 2048 + 7 + 7 + 4, frame.length);
        assertEquals(ApnsWireFormat.MAX_FRAME_LENGTH, frame.length);
    }

    @Test
    void oversizedPayloadIsRejectedLocally()
    {
        EncodeException e = assertThrows(EncodeException.class, () ->
                encoder.encode(notification(1, new byte[32], new byte[2049], 0L, Priority.IMMEDIATE)));

        assertEquals(ProtocolError.INVALID_PAYLOAD_SIZE, e.reason());
    }

    @Test
    void oversizedTokenIsRejectedLocally()
    {
        EncodeException e = assertThrows(EncodeException.class, () ->
                encoder.encode(notification(1, new byte[256], new byte[10], 0L, Priority.IMMEDIATE)));

        assertEquals(ProtocolError.INVALID_TOKEN_SIZE, e.reason());
    }

    @Test
    void emptyTokenAndPayloadMapToMissingErrors()
    {
        assertEquals(ProtocolError.MISSING_TOKEN, assertThrows(EncodeException.class, () ->
                encoder.encode(notification(1, new byte[0], new byte[10], 0L, Priority.IMMEDIATE))).reason());

        assertEquals(ProtocolError.MISSING_PAYLOAD, assertThrows(EncodeException.class, () ->
                encoder.encode(notification(1, new byte[32], new byte[0], 0L, Priority.IMMEDIATE))).reason());
    }

    @Test
    void encodingIsDeterministic()
    {
        Notification n = notification(42, new byte[] { 9, 8, 7 }, new byte[] { '{', '}' }, 1234L, Priority.IMMEDIATE);

        assertArrayEquals(encoder.encode(n), encoder.encode(n));
    }
}
