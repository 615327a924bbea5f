package com.questrail.push.protocol.apns.internal.connection;

import com.questrail.push.api.DeliveryError;
import com.questrail.push.protocol.apns.codec.ApnsFrameDecoder;
import com.questrail.push.protocol.apns.codec.ApnsFrameEncoder;
import com.questrail.push.protocol.apns.codec.EncodeException;
import com.questrail.push.protocol.apns.codec.MalformedFrameException;
import com.questrail.push.protocol.apns.config.ApnsEndpoint;
import com.questrail.push.protocol.apns.internal.connection.ConnectionOutcome.SettleReason;
import com.questrail.push.protocol.apns.internal.exec.ApnsTimingPolicy;
import com.questrail.push.protocol.apns.internal.replay.ReplaySplit;
import com.questrail.push.protocol.apns.internal.replay.ReplayWindow;
import com.questrail.push.protocol.apns.internal.time.SystemWallClock;
import com.questrail.push.protocol.apns.model.ErrorResponse;
import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.observability.ApnsConnectionOutcomeEvent;
import com.questrail.push.protocol.apns.observability.ApnsObservabilitySink;
import com.questrail.push.protocol.apns.observability.ApnsProtocolEvent;
import com.questrail.push.protocol.apns.observability.ApnsStateTransitionEvent;
import com.questrail.push.protocol.apns.observability.NullObservabilitySink;
import com.questrail.push.protocol.apns.transport.StreamEndpoint;
import com.questrail.push.protocol.apns.transport.StreamEndpointListener;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * ApnsConnection
 * =============================================================================
 * One incarnation of a gateway connection: connect, send until something ends
 * the stream, then work out which notifications must be sent again.
 *
 * <h2>Duties</h2>
 * <ul>
 *   <li><b>Send duty</b> ({@link #run(NotificationSource)}): runs on the
 *       calling worker thread. Takes notifications from the source, encodes
 *       them, admits them to the {@link ReplayWindow} and writes them.</li>
 *   <li><b>Read duty</b> ({@link #onBytes(byte[])}, {@link #onClosed(Throwable)}):
 *       runs on the transport's I/O thread. Waits for the one error frame the
 *       gateway may send before closing, or for the close itself.</li>
 * </ul>
 * Neither duty waits on the other. State, window and outcome are only changed
 * while holding {@code lock}, and the outcome is resolved exactly once.
 *
 * <h2>Resolution</h2>
 * <pre>
 *   error frame, permanent status  → ErrorReported   (failed entry reported, later entries replayed)
 *   error frame, SHUTDOWN status   → ServerShutdown  (later entries replayed)
 *   close / unreadable frame       → ClosedWithoutError (whole window replayed)
 *   window full / local shutdown   → Settled         (after the delivery grace, window presumed delivered)
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * A connection is used once: {@link #open(Duration)}, then {@link #run(NotificationSource)}.
 * Reconnecting means creating a new connection over a new endpoint.
 */
public final class ApnsConnection implements StreamEndpointListener
{
    private final String name;
    private final ApnsEndpoint remote;
    private final StreamEndpoint endpoint;
    private final ApnsFrameEncoder encoder;
    private final ApnsFrameDecoder decoder;
    private final ReplayWindow window;
    private final ApnsTimingPolicy timing;
    private final Consumer<DeliveryError> localRejections;
    private final ApnsObservabilitySink observabilitySink;

    private final Object lock = new Object();
    private final CompletableFuture<ConnectionOutcome> outcome = new CompletableFuture<>();

    // Guarded by lock.
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private boolean resolved;
    private boolean closedWhileConnecting;
    private byte[] inbound = new byte[0];

    public ApnsConnection(String name,
                          ApnsEndpoint remote,
                          StreamEndpoint endpoint,
                          ApnsFrameEncoder encoder,
                          ApnsFrameDecoder decoder,
                          ReplayWindow window,
                          ApnsTimingPolicy timing,
                          Consumer<DeliveryError> localRejections,
                          ApnsObservabilitySink observabilitySink)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.window = Objects.requireNonNull(window, "window");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.localRejections = Objects.requireNonNull(localRejections, "localRejections");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Connect, including the TLS handshake, and move to {@code READY}.
     *
     * @throws ApnsConnectException if the stream could not be established in time;
     *         the connection is then {@code DISCONNECTED} and finished
     */
    public void open(Duration timeout) throws ApnsConnectException, InterruptedException
    {
        synchronized (lock) {
            transition(ConnectionState.CONNECTING);
        }
        endpoint.setListener(this);

        try {
            endpoint.connect().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (ExecutionException e) {
            throw connectFailed("connect failed", e.getCause());
        }
        catch (TimeoutException e) {
            throw connectFailed("connect timed out after " + timeout.toMillis() + " ms", e);
        }
        catch (InterruptedException e) {
            connectFailed("connect interrupted", e);
            throw e;
        }

        synchronized (lock) {
            if (closedWhileConnecting) {
                throw connectFailed("closed during connect", null);
            }
            transition(ConnectionState.READY);
        }
    }

    private ApnsConnectException connectFailed(String message, Throwable cause)
    {
        endpoint.close();
        synchronized (lock) {
            if (state == ConnectionState.CONNECTING) {
                transition(ConnectionState.DISCONNECTED);
            }
            resolved = true;
        }
        return new ApnsConnectException(remote, message, cause);
    }

    /**
     * The send duty. Returns when this incarnation has ended.
     *
     * <p>Every notification taken from {@code source} is handed back to it
     * exactly once. Notifications left in the window are part of the returned
     * outcome's replay list; re-enqueueing them is the caller's job.</p>
     */
    public ConnectionOutcome run(NotificationSource source)
    {
        Objects.requireNonNull(source, "source");
        synchronized (lock) {
            if (!state.acceptsWork()) {
                throw new IllegalStateException(name + " is not open: " + state);
            }
        }

        try {
            while (true) {
                if (isResolved()) {
                    return outcome.join();
                }

                window.purgeExpired();

                if (source.isShutdown()) {
                    return settle(SettleReason.SHUTDOWN_REQUESTED);
                }

                Optional<Notification> next = source.poll(timing.pollInterval());
                if (next.isEmpty()) {
                    continue;
                }

                Notification notification = next.get();
                byte[] frame;
                try {
                    frame = encoder.encode(notification);
                }
                catch (EncodeException e) {
                    source.markProcessed(notification);
                    protocolEvent(ApnsProtocolEvent.Kind.REJECTED_LOCALLY, notification + ": " + e.getMessage());
                    localRejections.accept(DeliveryError.of(e.reason(), notification));
                    continue;
                }

                final boolean admitted;
                synchronized (lock) {
                    if (!state.acceptsWork()) {
                        source.requeue(notification);
                        continue;
                    }
                    admitted = window.offer(notification);
                }
                if (!admitted) {
                    source.requeue(notification);
                    protocolEvent(ApnsProtocolEvent.Kind.WINDOW_FULL,
                            "window holds " + window.size() + "; settling before " + notification);
                    return settle(SettleReason.WINDOW_FULL);
                }

                Throwable writeFailure = null;
                try {
                    endpoint.write(frame).get(timing.writeTimeout().toNanos(), TimeUnit.NANOSECONDS);
                }
                catch (ExecutionException e) {
                    writeFailure = e.getCause();
                }
                catch (TimeoutException e) {
                    writeFailure = e;
                }
                finally {
                    source.markProcessed(notification);
                }

                if (writeFailure != null) {
                    return abort(writeFailure);
                }
                protocolEvent(ApnsProtocolEvent.Kind.SENT, notification.toString());
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return abandon(e);
        }
    }

    /**
     * Stop sending and wait for the gateway to either report an error or stay
     * silent for the delivery grace period.
     */
    private ConnectionOutcome settle(SettleReason reason)
    {
        synchronized (lock) {
            if (!resolved) {
                transition(ConnectionState.DRAINING);
                if (window.isEmpty()) {
                    finish(new ConnectionOutcome.Settled(0, reason));
                }
            }
        }
        return awaitOutcome(timing.deliveryGrace(),
                () -> new ConnectionOutcome.Settled(window.size(), reason));
    }

    /**
     * The stream failed under the send duty. The read duty normally observes
     * the close; if it does not within the write timeout, resolve here.
     */
    private ConnectionOutcome abort(Throwable cause)
    {
        endpoint.close();
        return awaitOutcome(timing.writeTimeout(),
                () -> new ConnectionOutcome.ClosedWithoutError(window.drainAll(), cause));
    }

    /**
     * The worker was interrupted. The shutdown budget is spent, so the window
     * is handed back for replay instead of waiting out the grace period.
     */
    private ConnectionOutcome abandon(InterruptedException cause)
    {
        synchronized (lock) {
            if (!resolved) {
                finish(new ConnectionOutcome.ClosedWithoutError(window.drainAll(), cause));
            }
        }
        return outcome.join();
    }

    private ConnectionOutcome awaitOutcome(Duration wait, Supplier<ConnectionOutcome> fallback)
    {
        try {
            return outcome.get(wait.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            synchronized (lock) {
                if (!resolved) {
                    finish(fallback.get());
                }
            }
            return outcome.join();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return abandon(e);
        }
        catch (ExecutionException e) {
            throw new IllegalStateException("connection outcome failed", e.getCause());
        }
    }

    // -------------------------------------------------------------------------
    // Read duty
    // -------------------------------------------------------------------------

    @Override
    public void onBytes(byte[] bytes)
    {
        synchronized (lock) {
            if (resolved) {
                return;
            }

            byte[] joined = Arrays.copyOf(inbound, inbound.length + bytes.length);
            System.arraycopy(bytes, 0, joined, inbound.length, bytes.length);
            inbound = joined;

            if (inbound.length < 6 || state == ConnectionState.CONNECTING) {
                return;
            }

            ConnectionOutcome result;
            try {
                result = classify(decoder.decodeError(Arrays.copyOf(inbound, 6)));
            }
            catch (MalformedFrameException e) {
                result = new ConnectionOutcome.ClosedWithoutError(window.drainAll(), e);
            }
            finish(result);
        }
    }

    @Override
    public void onClosed(Throwable cause)
    {
        synchronized (lock) {
            if (resolved) {
                return;
            }
            if (state == ConnectionState.CONNECTING) {
                closedWhileConnecting = true;
                return;
            }
            // A partial error frame in the buffer is unreadable and ends the same way.
            finish(new ConnectionOutcome.ClosedWithoutError(window.drainAll(), cause));
        }
    }

    private ConnectionOutcome classify(ErrorResponse response)
    {
        ReplaySplit split = window.split(response.identifier());

        if (!response.error().isPermanent()) {
            return new ConnectionOutcome.ServerShutdown(response.identifier(), split.replay());
        }
        return new ConnectionOutcome.ErrorReported(response, split.failed(), split.replay());
    }

    /**
     * Resolve this incarnation. Caller holds {@code lock}.
     */
    private void finish(ConnectionOutcome result)
    {
        resolved = true;
        if (state == ConnectionState.READY) {
            transition(ConnectionState.DRAINING);
        }
        window.clear();
        endpoint.close();
        transition(ConnectionState.DISCONNECTED);

        observabilitySink.onConnectionOutcome(new ApnsConnectionOutcomeEvent(
                SystemWallClock.INSTANCE.now(), name, result));
        outcome.complete(result);
    }

    private void transition(ConnectionState next)
    {
        ConnectionState previous = state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException(name + ": illegal transition " + previous + " -> " + next);
        }
        state = next;
        observabilitySink.onStateTransition(new ApnsStateTransitionEvent(
                SystemWallClock.INSTANCE.now(), name, previous, next));
    }

    private void protocolEvent(ApnsProtocolEvent.Kind kind, String detail)
    {
        observabilitySink.onProtocolEvent(new ApnsProtocolEvent(
                SystemWallClock.INSTANCE.now(), name, kind, detail));
    }

    private boolean isResolved()
    {
        synchronized (lock) {
            return resolved;
        }
    }

    public ConnectionState state()
    {
        synchronized (lock) {
            return state;
        }
    }

    /** Completes once, when this incarnation has ended. */
    public CompletableFuture<ConnectionOutcome> outcome()
    {
        return outcome;
    }

    /**
     * Notifications whose outcome this connection still owns: the window while
     * running, the replay list once resolved.
     */
    public int outstanding()
    {
        synchronized (lock) {
            if (!resolved) {
                return window.size();
            }
            return outcome.isDone() ? outcome.join().replay().size() : 0;
        }
    }

    public String name()
    {
        return name;
    }
}
