package com.questrail.push.protocol.apns.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Notification
 * -----------------------------------------------------------------------------
 * One token-targeted push submission with its correlation identifier.
 *
 * <p>A notification is immutable. Its byte arrays are copied on the way in and
 * on the way out, so a notification can be handed between the queue, a
 * connection and the replay window without any party observing another's
 * mutations.</p>
 *
 * <h2>Field semantics</h2>
 * <ul>
 *   <li><b>identifier</b>: client-chosen 32-bit correlation value. The wire
 *       treats it as unsigned; Java arithmetic on it wraps, which is fine
 *       because nothing orders notifications by identifier.</li>
 *   <li><b>token</b>: opaque binary device token.</li>
 *   <li><b>payload</b>: serialized payload bytes (normally UTF-8 JSON).</li>
 *   <li><b>expiration</b>: epoch seconds as an unsigned 32-bit value;
 *       {@code 0} asks the gateway not to store the notification.</li>
 *   <li><b>enqueuedAt</b>: local timestamp for diagnostics only.</li>
 * </ul>
 *
 * <p>Size limits are deliberately <em>not</em> checked here: they are wire
 * rules and are enforced by the frame encoder.</p>
 */
public record Notification(
        int identifier,
        byte[] token,
        byte[] payload,
        long expiration,
        Priority priority,
        Instant enqueuedAt
) {
    /** Largest expiration value representable in the 4-byte expiration item. */
    public static final long MAX_EXPIRATION = 0xFFFF_FFFFL;

    public Notification {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        if (expiration < 0 || expiration > MAX_EXPIRATION) {
            throw new IllegalArgumentException("expiration out of range: " + expiration);
        }
        token = token.clone();
        payload = payload.clone();
    }

    @Override
    public byte[] token() {
        return token.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int tokenLength() {
        return token.length;
    }

    public int payloadLength() {
        return payload.length;
    }

    /** Lower-case hex rendering of the device token. */
    public String tokenHex() {
        return HexFormat.of().formatHex(token);
    }

    /** Identifier rendered as the unsigned value seen on the wire. */
    public String identifierString() {
        return Integer.toUnsignedString(identifier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Notification that)) return false;
        return identifier == that.identifier
                && expiration == that.expiration
                && priority == that.priority
                && Arrays.equals(token, that.token)
                && Arrays.equals(payload, that.payload)
                && enqueuedAt.equals(that.enqueuedAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(identifier, expiration, priority, enqueuedAt);
        result = 31 * result + Arrays.hashCode(token);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Notification[id=" + identifierString() + ", token=" + tokenHex()
                + ", payload=" + payload.length + " bytes, priority=" + priority + "]";
    }
}
