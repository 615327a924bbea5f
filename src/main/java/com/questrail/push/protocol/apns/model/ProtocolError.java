package com.questrail.push.protocol.apns.model;

/**
 * ProtocolError
 * -----------------------------------------------------------------------------
 * Closed taxonomy of the status codes carried by an APNs error-response frame.
 *
 * <p>Each constant is bound 1:1 to the raw status byte sent by the gateway.
 * Status bytes that are not listed here map to {@link #UNKNOWN}; decoding an
 * error frame therefore never fails because of an unrecognized status.</p>
 *
 * <h2>Permanence</h2>
 * <p>Every status except {@link #SHUTDOWN} names a notification that the
 * gateway rejected and that must not be resent. {@link #SHUTDOWN} is sent when
 * the gateway closes the connection for maintenance; its identifier names the
 * last notification that was processed successfully and nothing failed.</p>
 */
public enum ProtocolError
{
    PROCESSING(1, "Processing error"),
    MISSING_TOKEN(2, "Missing device token"),
    MISSING_TOPIC(3, "Missing topic"),
    MISSING_PAYLOAD(4, "Missing payload"),
    INVALID_TOKEN_SIZE(5, "Invalid token size"),
    INVALID_TOPIC_SIZE(6, "Invalid topic size"),
    INVALID_PAYLOAD_SIZE(7, "Invalid payload size"),
    INVALID_TOKEN(8, "Invalid token"),
    SHUTDOWN(10, "Shutdown"),
    UNKNOWN(255, "Unknown");

    private static final ProtocolError[] BY_STATUS = new ProtocolError[256];

    static {
        for (ProtocolError error : values()) {
            BY_STATUS[error.status] = error;
        }
    }

    private final int status;
    private final String description;

    ProtocolError(int status, String description)
    {
        this.status = status;
        this.description = description;
    }

    /**
     * Maps a raw status byte to its semantic error.
     *
     * @param status status value, either as an unsigned value or a raw signed byte
     * @return the matching error, or {@link #UNKNOWN} for unrecognized values
     */
    public static ProtocolError fromStatus(int status)
    {
        ProtocolError error = BY_STATUS[status & 0xFF];
        return error != null ? error : UNKNOWN;
    }

    /** Wire value of this status. */
    public int status()
    {
        return status;
    }

    public String description()
    {
        return description;
    }

    /**
     * Returns {@code true} if the named notification was rejected and must be
     * reported to the caller rather than resent.
     */
    public boolean isPermanent()
    {
        return this != SHUTDOWN;
    }
}
