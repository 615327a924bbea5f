package com.questrail.push.protocol.apns.feedback;

import com.questrail.push.protocol.apns.codec.MalformedFrameException;
import com.questrail.push.protocol.apns.codec.impl.FeedbackStreamDecoder;
import com.questrail.push.protocol.apns.config.ApnsEndpoint;
import com.questrail.push.protocol.apns.internal.time.SystemWallClock;
import com.questrail.push.protocol.apns.model.Feedback;
import com.questrail.push.protocol.apns.observability.ApnsErrorEvent;
import com.questrail.push.protocol.apns.observability.ApnsObservabilitySink;
import com.questrail.push.protocol.apns.observability.ApnsTransportEvent;
import com.questrail.push.protocol.apns.observability.NullObservabilitySink;
import com.questrail.push.protocol.apns.transport.StreamEndpoint;
import com.questrail.push.protocol.apns.transport.StreamEndpointListener;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * FeedbackReader
 * =============================================================================
 * One-shot reader for the feedback service.
 *
 * <p>The feedback service sends every stale-device record it holds for the
 * client's certificate and then closes the connection. There is nothing to
 * send and no request framing: connecting is the request.</p>
 *
 * <h2>Delivery</h2>
 * Records are decoded as bytes arrive and passed to the callback one at a
 * time, in stream order, on the transport's I/O thread. The future returned by
 * {@link #start()} completes with the number of records once the service
 * closes the stream; zero records is a normal result.
 *
 * <h2>Failure</h2>
 * The future completes exceptionally if the connection cannot be made, the
 * transport fails, the stream ends inside a record, or the callback throws.
 * Records already delivered stay delivered.
 */
public final class FeedbackReader implements StreamEndpointListener
{
    private static final String NAME = "apns-feedback";

    private final ApnsEndpoint remote;
    private final StreamEndpoint endpoint;
    private final Consumer<Feedback> callback;
    private final Duration connectTimeout;
    private final ApnsObservabilitySink observabilitySink;

    private final FeedbackStreamDecoder decoder = new FeedbackStreamDecoder();
    private final CompletableFuture<Integer> result = new CompletableFuture<>();

    // Only touched from the serialized listener callbacks.
    private int delivered;

    public FeedbackReader(ApnsEndpoint remote,
                          StreamEndpoint endpoint,
                          Consumer<Feedback> callback,
                          Duration connectTimeout,
                          ApnsObservabilitySink observabilitySink)
    {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Connect and start reading. Call once.
     *
     * @return completes with the number of records delivered
     */
    public CompletableFuture<Integer> start()
    {
        endpoint.setListener(this);
        endpoint.connect()
                .orTimeout(connectTimeout.toNanos(), TimeUnit.NANOSECONDS)
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        observabilitySink.onTransportEvent(new ApnsTransportEvent(
                                SystemWallClock.INSTANCE.now(), NAME, ApnsTransportEvent.Kind.CONNECT_FAILED,
                                remote, 1, failure));
                        fail(failure);
                    }
                    else {
                        observabilitySink.onTransportEvent(new ApnsTransportEvent(
                                SystemWallClock.INSTANCE.now(), NAME, ApnsTransportEvent.Kind.CONNECTED,
                                remote, 0, null));
                    }
                });
        return result;
    }

    @Override
    public void onBytes(byte[] bytes)
    {
        if (result.isDone()) {
            return;
        }
        try {
            for (Feedback feedback : decoder.feed(bytes)) {
                callback.accept(feedback);
                delivered++;
            }
        }
        catch (RuntimeException e) {
            fail(e);
        }
    }

    @Override
    public void onClosed(Throwable cause)
    {
        if (result.isDone()) {
            return;
        }
        if (cause != null) {
            fail(cause);
            return;
        }
        try {
            decoder.finish();
        }
        catch (MalformedFrameException e) {
            fail(e);
            return;
        }
        result.complete(delivered);
    }

    private void fail(Throwable cause)
    {
        if (result.completeExceptionally(cause)) {
            observabilitySink.onError(new ApnsErrorEvent(
                    SystemWallClock.INSTANCE.now(), "feedback read from " + remote + " failed", cause));
            endpoint.close();
        }
    }
}
