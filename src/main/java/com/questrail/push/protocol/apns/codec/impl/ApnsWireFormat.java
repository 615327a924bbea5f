package com.questrail.push.protocol.apns.codec.impl;

/**
 * ApnsWireFormat
 * -----------------------------------------------------------------------------
 * Constants of the APNs binary interface.
 *
 * <p>Outbound notification frame (command 2):</p>
 * <pre>
 *   +---------+----------------+-----------------------------------------+
 *   | 1 byte  | 4 bytes (BE)   | items...                                |
 *   | command | frame length   | id (1) | length (2, BE) | data (length) |
 *   +---------+----------------+-----------------------------------------+
 * </pre>
 *
 * <p>Inbound error frame (command 8): {@code command(1) status(1) identifier(4, BE)}.</p>
 *
 * <p>Feedback record: {@code timestamp(4, BE) tokenLength(2, BE) token(tokenLength)},
 * repeated until the gateway closes the stream.</p>
 */
final class ApnsWireFormat
{
    /** Command tag of the item-framed notification format. */
    static final int COMMAND_NOTIFICATION = 2;

    /** Command tag of an error-response frame. */
    static final int COMMAND_ERROR_RESPONSE = 8;

    static final int ITEM_DEVICE_TOKEN = 1;
    static final int ITEM_PAYLOAD = 2;
    static final int ITEM_IDENTIFIER = 3;
    static final int ITEM_EXPIRATION = 4;
    static final int ITEM_PRIORITY = 5;

    /** Item header: id byte plus 2-byte length. */
    static final int ITEM_HEADER_LENGTH = 3;

    /** Frame header: command byte plus 4-byte length. */
    static final int FRAME_HEADER_LENGTH = 5;

    static final int MAX_TOKEN_LENGTH = 255;
    static final int MAX_PAYLOAD_LENGTH = 2048;

    /** Largest frame the encoder will emit: every item at its maximum size. */
    static final int MAX_FRAME_LENGTH = FRAME_HEADER_LENGTH
            + ITEM_HEADER_LENGTH + MAX_TOKEN_LENGTH
            + ITEM_HEADER_LENGTH + MAX_PAYLOAD_LENGTH
            + ITEM_HEADER_LENGTH + 4
            + ITEM_HEADER_LENGTH + 4
            + ITEM_HEADER_LENGTH + 1;

    static final int ERROR_FRAME_LENGTH = 6;

    /** Fixed part of a feedback record: timestamp plus token length. */
    static final int FEEDBACK_HEADER_LENGTH = 6;

    private ApnsWireFormat() {}
}
