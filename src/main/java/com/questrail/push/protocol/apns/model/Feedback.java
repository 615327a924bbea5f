package com.questrail.push.protocol.apns.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A single record from the feedback service: a device token that can no
 * longer receive notifications, and the time at which the gateway determined
 * so.
 *
 * <p>If the device was registered with the application after {@code when},
 * the record can be ignored.</p>
 */
public record Feedback(byte[] token, Instant when) {

    public Feedback {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(when, "when");
        token = token.clone();
    }

    @Override
    public byte[] token() {
        return token.clone();
    }

    /** Lower-case hex rendering of the device token. */
    public String tokenHex() {
        return HexFormat.of().formatHex(token);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Feedback that)) return false;
        return Arrays.equals(token, that.token) && when.equals(that.when);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(token) + when.hashCode();
    }

    @Override
    public String toString() {
        return "Feedback[token=" + tokenHex() + ", when=" + when + "]";
    }
}
