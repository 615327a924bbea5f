package com.questrail.push.protocol.apns.backend.threaded;

import com.questrail.push.api.DeliveryError;
import com.questrail.push.protocol.apns.backend.ApnsUnavailableException;
import com.questrail.push.protocol.apns.backend.BackendContext;
import com.questrail.push.protocol.apns.config.ApnsEndpoint;
import com.questrail.push.protocol.apns.internal.connection.ApnsConnectException;
import com.questrail.push.protocol.apns.internal.connection.ApnsConnection;
import com.questrail.push.protocol.apns.internal.connection.ConnectionOutcome;
import com.questrail.push.protocol.apns.internal.exec.ApnsTimingPolicy;
import com.questrail.push.protocol.apns.internal.exec.ConnectAttemptTracker;
import com.questrail.push.protocol.apns.internal.exec.ReconnectBackoff;
import com.questrail.push.protocol.apns.internal.queue.NotificationQueue;
import com.questrail.push.protocol.apns.internal.replay.ReplayWindow;
import com.questrail.push.protocol.apns.internal.time.SystemMonotonicClock;
import com.questrail.push.protocol.apns.internal.time.SystemWallClock;
import com.questrail.push.protocol.apns.observability.ApnsErrorEvent;
import com.questrail.push.protocol.apns.observability.ApnsProtocolEvent;
import com.questrail.push.protocol.apns.observability.ApnsTransportEvent;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * ConnectionWorker
 * =============================================================================
 * The loop run by one connection thread of {@link ThreadedPushBackend}.
 *
 * <pre>
 *   wait for work ─► connect ─► run until the incarnation ends ─► hand back replay ─┐
 *        ▲              │ failed                                                    │
 *        │              ▼                                                           │
 *        └────────── backoff ◄──────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Connections are opened lazily: a worker does not connect until the
 * queue has something to send.</p>
 */
final class ConnectionWorker implements Runnable
{
    private final int slot;
    private final String name;
    private final BackendContext context;
    private final ApnsTimingPolicy timing;
    private final ConnectAttemptTracker attempts;
    private final ReconnectBackoff backoff;
    private final Consumer<DeliveryError> errors;
    private final Consumer<ApnsUnavailableException> fatal;

    private volatile ApnsConnection current;

    ConnectionWorker(int slot,
                     BackendContext context,
                     ConnectAttemptTracker attempts,
                     Consumer<DeliveryError> errors,
                     Consumer<ApnsUnavailableException> fatal)
    {
        this.slot = slot;
        this.name = "apns-connection-" + slot;
        this.context = context;
        this.timing = context.config().timingPolicy();
        this.attempts = attempts;
        this.backoff = ReconnectBackoff.from(timing);
        this.errors = errors;
        this.fatal = fatal;
    }

    String name()
    {
        return name;
    }

    /** Notifications held by the current incarnation; 0 when not connected. */
    int outstanding()
    {
        ApnsConnection c = current;
        return c == null ? 0 : c.outstanding();
    }

    @Override
    public void run()
    {
        final NotificationQueue queue = context.queue();

        try {
            while (!Thread.currentThread().isInterrupted()) {
                if (!queue.awaitAvailable(timing.pollInterval())) {
                    if (queue.isShutdown()) {
                        break;
                    }
                    continue;
                }

                ApnsConnection connection = newConnection();
                try {
                    connection.open(timing.connectTimeout());
                }
                catch (ApnsConnectException e) {
                    onConnectFailed(e);
                    continue;
                }

                attempts.reset(slot);
                context.observabilitySink().onTransportEvent(new ApnsTransportEvent(
                        SystemWallClock.INSTANCE.now(), name, ApnsTransportEvent.Kind.CONNECTED,
                        context.config().gateway(), 0, null));

                current = connection;
                try {
                    handle(connection.run(queue));
                }
                finally {
                    current = null;
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        catch (RuntimeException e) {
            context.observabilitySink().onError(new ApnsErrorEvent(
                    SystemWallClock.INSTANCE.now(), name + " stopped unexpectedly", e));
            throw e;
        }
    }

    private ApnsConnection newConnection()
    {
        ApnsEndpoint gateway = context.config().gateway();
        return new ApnsConnection(
                name,
                gateway,
                context.endpoints().create(gateway),
                context.encoder(),
                context.decoder(),
                new ReplayWindow(context.config().replayWindowCapacity(), timing.deliveryGrace(), context.clock()),
                timing,
                errors,
                context.observabilitySink());
    }

    private void handle(ConnectionOutcome outcome)
    {
        if (outcome instanceof ConnectionOutcome.ErrorReported reported) {
            errors.accept(new DeliveryError(
                    reported.response().error(),
                    reported.response().status(),
                    reported.failed()));
        }

        if (!outcome.replay().isEmpty()) {
            context.queue().enqueueFront(outcome.replay());
            context.observabilitySink().onProtocolEvent(new ApnsProtocolEvent(
                    SystemWallClock.INSTANCE.now(), name, ApnsProtocolEvent.Kind.REPLAY_ENQUEUED,
                    outcome.replay().size() + " notifications"));
        }
    }

    private void onConnectFailed(ApnsConnectException e) throws InterruptedException
    {
        final int failures = attempts.recordFailure(slot);

        context.observabilitySink().onTransportEvent(new ApnsTransportEvent(
                SystemWallClock.INSTANCE.now(), name, ApnsTransportEvent.Kind.CONNECT_FAILED,
                e.remote(), failures, e));

        // One report per outage, whichever slot gets there first.
        if (failures == timing.maxConnectAttempts() && attempts.claimOutageReport()) {
            fatal.accept(new ApnsUnavailableException(e.remote(), failures, e));
        }

        pause(backoff.delayFor(failures));
    }

    /**
     * Sleep for the backoff delay, returning early if the queue shuts down.
     */
    private void pause(Duration delay) throws InterruptedException
    {
        final long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + delay.toNanos();
        final long sliceMillis = Math.max(1, timing.pollInterval().toMillis());

        long remaining;
        while ((remaining = deadline - SystemMonotonicClock.INSTANCE.nowNanos()) > 0) {
            if (context.queue().isShutdown()) {
                return;
            }
            Thread.sleep(Math.min(sliceMillis, Math.max(1, remaining / 1_000_000)));
        }
    }
}
