package com.questrail.push.protocol.apns.internal.connection;

import com.questrail.push.protocol.apns.model.Notification;

import java.time.Duration;
import java.util.Optional;

/**
 * The consumer side of the notification queue, as seen by a connection.
 *
 * <p>Every notification obtained from {@link #poll(Duration)} must be handed
 * back exactly once through {@link #markProcessed(Notification)} or
 * {@link #requeue(Notification)}.</p>
 */
public interface NotificationSource
{
    /**
     * @return the next notification, or empty if none arrived within
     *         {@code timeout} or the source is shut down
     * @throws InterruptedException if the calling thread is interrupted
     */
    Optional<Notification> poll(Duration timeout) throws InterruptedException;

    /** The notification was written, or permanently rejected. */
    void markProcessed(Notification notification);

    /** The notification was not sent and goes back to the head of the queue. */
    void requeue(Notification notification);

    boolean isShutdown();
}
