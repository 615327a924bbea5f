package com.questrail.push.api;

import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.model.ProtocolError;

import java.util.Objects;
import java.util.Optional;

/**
 * A notification that will never be delivered.
 *
 * <p>Reported exactly once per permanently failed notification, either because
 * the gateway rejected it or because it could not be encoded locally.</p>
 *
 * @param error        semantic classification of the failure
 * @param status       raw status byte; differs from {@code error.status()}
 *                     only for statuses that map to {@link ProtocolError#UNKNOWN}
 * @param notification the failed notification, or empty if the gateway named
 *                     an identifier that was no longer held by the client
 */
public record DeliveryError(ProtocolError error, int status, Optional<Notification> notification) {

    public DeliveryError {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(notification, "notification");
    }

    public static DeliveryError of(ProtocolError error, Notification notification) {
        return new DeliveryError(error, error.status(), Optional.of(notification));
    }

    @Override
    public String toString() {
        return "DeliveryError[" + error + " (status " + status + "), "
                + notification.map(Notification::toString).orElse("notification unknown") + "]";
    }
}
