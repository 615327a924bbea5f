package com.questrail.push.protocol.apns.model;

/**
 * A decoded error-response frame: the raw status byte and the identifier of
 * the notification it refers to.
 *
 * <p>The raw status is kept alongside the classification so that diagnostics
 * can show values that collapsed into {@link ProtocolError#UNKNOWN}.</p>
 *
 * @param status     unsigned status byte (0-255)
 * @param identifier notification identifier as sent on the wire
 */
public record ErrorResponse(int status, int identifier) {

    public ErrorResponse {
        if (status < 0 || status > 0xFF) {
            throw new IllegalArgumentException("status must be an unsigned byte: " + status);
        }
    }

    public ProtocolError error() {
        return ProtocolError.fromStatus(status);
    }

    @Override
    public String toString() {
        return "ErrorResponse[status=" + status + " (" + error().description() + "), identifier="
                + Integer.toUnsignedString(identifier) + "]";
    }
}
