package com.questrail.push.protocol.apns.backend;

import com.questrail.push.api.DeliveryError;
import com.questrail.push.protocol.apns.codec.ApnsFrameDecoder;
import com.questrail.push.protocol.apns.codec.ApnsFrameEncoder;
import com.questrail.push.protocol.apns.config.ApnsClientConfig;
import com.questrail.push.protocol.apns.internal.queue.NotificationQueue;
import com.questrail.push.protocol.apns.internal.time.MonotonicClock;
import com.questrail.push.protocol.apns.observability.ApnsObservabilitySink;
import com.questrail.push.protocol.apns.transport.StreamEndpointFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Everything a backend needs from the client that owns it.
 *
 * @param errorHandler application callback for permanent failures
 * @param fatalHandler application callback for an unreachable gateway
 */
public record BackendContext(
    ApnsClientConfig config,
    NotificationQueue queue,
    StreamEndpointFactory endpoints,
    ApnsFrameEncoder encoder,
    ApnsFrameDecoder decoder,
    MonotonicClock clock,
    Consumer<DeliveryError> errorHandler,
    Consumer<ApnsUnavailableException> fatalHandler,
    ApnsObservabilitySink observabilitySink
) {
    public BackendContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(endpoints, "endpoints");
        Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(errorHandler, "errorHandler");
        Objects.requireNonNull(fatalHandler, "fatalHandler");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }
}
