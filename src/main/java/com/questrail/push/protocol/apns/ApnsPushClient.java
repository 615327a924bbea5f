package com.questrail.push.protocol.apns;

import com.questrail.push.api.DeliveryError;
import com.questrail.push.api.Message;
import com.questrail.push.api.PushClient;
import com.questrail.push.protocol.apns.backend.ApnsUnavailableException;
import com.questrail.push.protocol.apns.backend.BackendContext;
import com.questrail.push.protocol.apns.backend.PushBackend;
import com.questrail.push.protocol.apns.backend.PushBackendFactory;
import com.questrail.push.protocol.apns.backend.threaded.ThreadedPushBackend;
import com.questrail.push.protocol.apns.codec.ApnsFrameDecoder;
import com.questrail.push.protocol.apns.codec.ApnsFrameEncoder;
import com.questrail.push.protocol.apns.codec.impl.DefaultApnsFrameDecoder;
import com.questrail.push.protocol.apns.codec.impl.DefaultApnsFrameEncoder;
import com.questrail.push.protocol.apns.config.ApnsClientConfig;
import com.questrail.push.protocol.apns.feedback.FeedbackReader;
import com.questrail.push.protocol.apns.internal.queue.NotificationQueue;
import com.questrail.push.protocol.apns.internal.time.MonotonicClock;
import com.questrail.push.protocol.apns.internal.time.SystemMonotonicClock;
import com.questrail.push.protocol.apns.internal.time.SystemWallClock;
import com.questrail.push.protocol.apns.internal.time.WallClock;
import com.questrail.push.protocol.apns.model.Feedback;
import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.observability.ApnsErrorEvent;
import com.questrail.push.protocol.apns.observability.ApnsObservabilitySink;
import com.questrail.push.protocol.apns.observability.Slf4jApnsObservabilitySink;
import com.questrail.push.protocol.apns.transport.StreamEndpointFactory;
import com.questrail.push.protocol.apns.transport.tcp.netty.NettyStreamEndpointFactory;
import com.questrail.push.protocol.apns.transport.tcp.netty.SslContexts;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * ApnsPushClient
 * =============================================================================
 * Composition root and lifecycle owner for the push stack.
 *
 * <pre>
 *   ApnsPushClient client = ApnsPushClient.builder()
 *           .withConfig(ApnsClientConfig.builder()
 *                   .withEnvironment(ApnsEnvironment.SANDBOX)
 *                   .withCredentials(ApnsCredentials.of(chain, key))
 *                   .build())
 *           .withErrorHandler(error -> ...)
 *           .build();
 *
 *   client.send(Message.aps(tokens, ApsPayload.builder().alert("Hi").build()));
 *   client.awaitSettled(Duration.ofSeconds(30));
 *   client.close();
 * </pre>
 *
 * <p>The backend is started by {@link Builder#build()}. Connections are
 * opened lazily, when the first notification is queued.</p>
 */
public final class ApnsPushClient implements PushClient {
    private final ApnsClientConfig config;
    private final NotificationQueue queue;
    private final PushBackend backend;
    private final ApnsFrameEncoder encoder;
    private final StreamEndpointFactory endpoints;
    private final AutoCloseable ownedTransport;
    private final WallClock wallClock;
    private final ApnsObservabilitySink observabilitySink;

    private final AtomicInteger nextIdentifier;
    private final Object sendLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ApnsPushClient(Builder b,
                           StreamEndpointFactory endpoints,
                           AutoCloseable ownedTransport) {
        this.config = b.config;
        this.queue = new NotificationQueue();
        this.encoder = new DefaultApnsFrameEncoder();
        this.endpoints = endpoints;
        this.ownedTransport = ownedTransport;
        this.wallClock = b.wallClock;
        this.observabilitySink = b.observabilitySink;
        this.nextIdentifier = new AtomicInteger(b.firstIdentifier);

        Consumer<DeliveryError> errorHandler = b.errorHandler != null
                ? b.errorHandler
                : error -> observabilitySink.onError(new ApnsErrorEvent(
                        SystemWallClock.INSTANCE.now(), "undelivered: " + error, null));

        ApnsFrameDecoder decoder = new DefaultApnsFrameDecoder();
        this.backend = b.backendFactory.create(new BackendContext(
                config, queue, endpoints, encoder, decoder, b.clock,
                errorHandler, b.fatalHandler, observabilitySink));
    }

    @Override
    public List<Notification> send(Message message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            throw new IllegalStateException("client is shut down");
        }

        // Identifiers of one message stay contiguous and in queue order.
        synchronized (sendLock) {
            AtomicInteger cursor = new AtomicInteger(nextIdentifier.get());
            List<Notification> notifications = message.notifications(cursor::getAndIncrement, wallClock.now());

            for (Notification n : notifications) {
                encoder.encode(n);
            }

            nextIdentifier.set(cursor.get());
            for (Notification n : notifications) {
                queue.enqueue(n);
            }
            return notifications;
        }
    }

    @Override
    public void flush() throws InterruptedException {
        queue.drain();
    }

    @Override
    public boolean flush(Duration timeout) throws InterruptedException {
        return queue.drain(timeout);
    }

    @Override
    public boolean awaitSettled(Duration timeout) throws InterruptedException {
        return backend.awaitSettled(timeout);
    }

    @Override
    public CompletableFuture<Integer> fetchFeedback(Consumer<Feedback> callback) {
        if (closed.get()) {
            throw new IllegalStateException("client is shut down");
        }
        FeedbackReader reader = new FeedbackReader(
                config.feedback(),
                endpoints.create(config.feedback()),
                callback,
                config.timingPolicy().connectTimeout(),
                observabilitySink);
        return reader.start();
    }

    @Override
    public List<Notification> shutdown(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return List.of();
        }
        List<Notification> unsent = backend.stop(timeout);
        if (ownedTransport != null) {
            try {
                ownedTransport.close();
            } catch (Exception e) {
                observabilitySink.onError(new ApnsErrorEvent(
                        SystemWallClock.INSTANCE.now(), "transport shutdown failed", e));
            }
        }
        return unsent;
    }

    @Override
    public void close() {
        shutdown(config.timingPolicy().shutdownTimeout());
    }

    public ApnsClientConfig config() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ApnsClientConfig config = ApnsClientConfig.builder().build();
        private Consumer<DeliveryError> errorHandler;
        private Consumer<ApnsUnavailableException> fatalHandler = fatal -> { };
        private ApnsObservabilitySink observabilitySink = new Slf4jApnsObservabilitySink();
        private PushBackendFactory backendFactory = ThreadedPushBackend::new;
        private StreamEndpointFactory endpointFactory;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private int firstIdentifier;

        public Builder withConfig(ApnsClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Handler for notifications that will never be delivered. Without one,
         * failures are reported to the observability sink only.
         */
        public Builder withErrorHandler(Consumer<DeliveryError> handler) {
            this.errorHandler = handler;
            return this;
        }

        /**
         * Handler for a gateway that stays unreachable. Sending continues to
         * retry after the handler has been called.
         */
        public Builder withFatalHandler(Consumer<ApnsUnavailableException> handler) {
            this.fatalHandler = handler;
            return this;
        }

        public Builder withObservabilitySink(ApnsObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withBackendFactory(PushBackendFactory factory) {
            this.backendFactory = factory;
            return this;
        }

        /**
         * Replace the Netty transport, e.g. with an in-memory one. The client
         * does not close an injected factory.
         */
        public Builder withEndpointFactory(StreamEndpointFactory factory) {
            this.endpointFactory = factory;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withFirstIdentifier(int identifier) {
            this.firstIdentifier = identifier;
            return this;
        }

        /**
         * Build and start the client.
         *
         * @throws com.questrail.push.protocol.apns.config.ApnsConfigurationException
         *         if the TLS credentials cannot be loaded
         */
        public ApnsPushClient build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(fatalHandler, "fatalHandler");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(backendFactory, "backendFactory");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            StreamEndpointFactory endpoints = endpointFactory;
            NettyStreamEndpointFactory owned = null;
            if (endpoints == null) {
                owned = new NettyStreamEndpointFactory(
                        SslContexts.forClient(config.credentials()),
                        config.timingPolicy().connectTimeout(),
                        config.connectionCount() + 1);
                endpoints = owned;
            }

            ApnsPushClient client = new ApnsPushClient(this, endpoints, owned);
            client.backend.start();
            return client;
        }
    }
}
