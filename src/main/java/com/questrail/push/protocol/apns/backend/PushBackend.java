package com.questrail.push.protocol.apns.backend;

import com.questrail.push.api.DeliveryError;
import com.questrail.push.protocol.apns.model.Notification;

import java.time.Duration;
import java.util.List;

/**
 * PushBackend
 * =============================================================================
 * The concurrency strategy that drives gateway connections from the shared
 * notification queue.
 *
 * <p>A backend decides how many connections exist, on which threads their
 * send duties run, how reconnects are spaced, and on which thread the
 * application's callbacks are invoked. It does not decide what an error frame
 * means; that is fixed by the connection state machine.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   backend.start()               → connections begin pumping the queue
 *   backend.awaitSettled(timeout) → optional; wait for everything to be sent
 *   backend.stop(timeout)         → stop, returning notifications never sent
 * </pre>
 *
 * <p>Implementations are selected by injecting a {@link PushBackendFactory}
 * when the client is built.</p>
 */
public interface PushBackend
{
    /**
     * Start the backend. Idempotent.
     */
    void start();

    /**
     * Stop using the configured shutdown timeout.
     *
     * @see #stop(Duration)
     */
    List<Notification> stop();

    /**
     * Stop accepting work, give connections until {@code timeout} to settle,
     * then abandon them.
     *
     * @return notifications that were queued or waiting for replay and were
     *         not sent; the caller decides whether to resubmit them
     */
    List<Notification> stop(Duration timeout);

    /**
     * Deliver a permanent failure to the application.
     *
     * <p>Called once per permanently failed notification, never for a
     * transient condition. The application handler runs on a thread owned by
     * the backend.</p>
     */
    void notifyError(DeliveryError error);

    /**
     * Wait until the queue is empty and no connection holds a notification
     * whose outcome is still unknown.
     *
     * @return {@code true} if that state was reached within {@code timeout}
     */
    boolean awaitSettled(Duration timeout) throws InterruptedException;
}
