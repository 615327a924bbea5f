package com.questrail.push.api;

import com.questrail.push.protocol.apns.model.Feedback;
import com.questrail.push.protocol.apns.model.Notification;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * PushClient
 * -----------------------------------------------------------------------------
 * Application-facing entry point for sending push notifications.
 *
 * <p>A client is an explicitly owned instance: create it, use it, and shut it
 * down. It owns its connections, its queue and its callback thread.</p>
 *
 * <h2>Delivery guarantee</h2>
 * At least once. A notification may be delivered twice if the connection
 * fails in a way that leaves its fate unknown. A notification the gateway
 * rejects is reported once through the error handler and never resent.
 *
 * <h2>Callbacks</h2>
 * Error, fatal and feedback callbacks run on threads owned by the client.
 * Callers must not assume any particular thread, and with more than one
 * connection there is no ordering between notifications sent on different
 * connections.
 */
public interface PushClient extends AutoCloseable
{
    /**
     * Queue a message for delivery, one notification per device token.
     *
     * <p>Every notification of the message is validated before any is queued;
     * a message either goes out whole or not at all.</p>
     *
     * @return the queued notifications, with their assigned identifiers
     * @throws com.questrail.push.protocol.apns.codec.EncodeException if a
     *         notification would violate a wire size limit
     * @throws IllegalStateException if the client has been shut down
     */
    List<Notification> send(Message message);

    /**
     * Block until every queued notification has been written.
     */
    void flush() throws InterruptedException;

    /**
     * Bounded variant of {@link #flush()}.
     *
     * @return {@code true} if the queue drained within {@code timeout}
     */
    boolean flush(Duration timeout) throws InterruptedException;

    /**
     * Block until every queued notification has been written and has either
     * failed or outlived the delivery grace period.
     *
     * <p>Call this before letting a process exit if notifications that might
     * still need a replay must not be lost.</p>
     *
     * @return {@code true} if that state was reached within {@code timeout}
     */
    boolean awaitSettled(Duration timeout) throws InterruptedException;

    /**
     * Read the feedback service once.
     *
     * @param callback receives each stale-device record, in stream order
     * @return completes with the number of records once the service closes
     */
    CompletableFuture<Integer> fetchFeedback(Consumer<Feedback> callback);

    /**
     * Stop sending and release every resource.
     *
     * @return notifications that were never written; resubmitting them is up
     *         to the caller
     */
    List<Notification> shutdown(Duration timeout);

    /**
     * Shut down with the configured shutdown timeout.
     */
    @Override
    void close();
}
