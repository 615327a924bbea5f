package com.questrail.push.protocol.apns.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * ApnsTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for connections and the backend.
 *
 * <p>This is deliberately <em>operational only</em>. It does not decide what an
 * error frame means or which notifications are replayed; it only controls how
 * long the engine waits for things.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: Upper bound on TCP connect plus TLS handshake.</li>
 *   <li><b>writeTimeout</b>: Upper bound on a single frame write. A write that
 *       does not complete in time ends the connection incarnation.</li>
 *   <li><b>pollInterval</b>: How long a connection waits on an empty queue
 *       before it re-checks its replay window and its own state.</li>
 *   <li><b>deliveryGrace</b>: How long a sent notification stays in the replay
 *       window before it is presumed delivered. Also bounds how long a draining
 *       connection waits for a late error frame.</li>
 *   <li><b>reconnectInitialDelay</b> / <b>reconnectMaxDelay</b>: Exponential
 *       backoff between consecutive failed connect attempts.</li>
 *   <li><b>maxConnectAttempts</b>: Consecutive connect failures after which the
 *       gateway is reported unavailable. Retries continue afterwards.</li>
 *   <li><b>shutdownTimeout</b>: Default budget for {@code stop()}. Must exceed
 *       deliveryGrace: a stop that runs out its budget hands written
 *       notifications back as unsent.</li>
 * </ul>
 */
public record ApnsTimingPolicy(
        Duration connectTimeout,
        Duration writeTimeout,
        Duration pollInterval,
        Duration deliveryGrace,
        Duration reconnectInitialDelay,
        Duration reconnectMaxDelay,
        int maxConnectAttempts,
        Duration shutdownTimeout
) {
    /**
     * Canonical constructor with validation.
     */
    public ApnsTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(deliveryGrace, "deliveryGrace");
        Objects.requireNonNull(reconnectInitialDelay, "reconnectInitialDelay");
        Objects.requireNonNull(reconnectMaxDelay, "reconnectMaxDelay");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(writeTimeout, "writeTimeout");
        requirePositive(pollInterval, "pollInterval");
        if (deliveryGrace.isNegative()) {
            throw new IllegalArgumentException("deliveryGrace must be non-negative");
        }
        if (reconnectInitialDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectInitialDelay must be non-negative");
        }
        if (reconnectMaxDelay.compareTo(reconnectInitialDelay) < 0) {
            throw new IllegalArgumentException("reconnectMaxDelay must be >= reconnectInitialDelay");
        }
        if (maxConnectAttempts < 1) {
            throw new IllegalArgumentException("maxConnectAttempts must be >= 1");
        }
        if (shutdownTimeout.compareTo(deliveryGrace) <= 0) {
            throw new IllegalArgumentException("shutdownTimeout must exceed deliveryGrace");
        }
    }

    /**
     * Creates a policy with defaults suited to the production gateway.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>connectTimeout: 10s</li>
     *   <li>writeTimeout: 10s</li>
     *   <li>pollInterval: 100ms</li>
     *   <li>deliveryGrace: 5s</li>
     *   <li>reconnectInitialDelay: 100ms</li>
     *   <li>reconnectMaxDelay: 30s</li>
     *   <li>maxConnectAttempts: 5</li>
     *   <li>shutdownTimeout: 10s</li>
     * </ul>
     */
    public static ApnsTimingPolicy defaults() {
        return new ApnsTimingPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(10),
                Duration.ofMillis(100),
                Duration.ofSeconds(5),
                Duration.ofMillis(100),
                Duration.ofSeconds(30),
                5,
                Duration.ofSeconds(10)
        );
    }

    public ApnsTimingPolicy withDeliveryGrace(Duration grace) {
        return new ApnsTimingPolicy(connectTimeout, writeTimeout, pollInterval, grace,
                reconnectInitialDelay, reconnectMaxDelay, maxConnectAttempts, shutdownTimeout);
    }

    public ApnsTimingPolicy withPollInterval(Duration interval) {
        return new ApnsTimingPolicy(connectTimeout, writeTimeout, interval, deliveryGrace,
                reconnectInitialDelay, reconnectMaxDelay, maxConnectAttempts, shutdownTimeout);
    }

    public ApnsTimingPolicy withReconnectDelays(Duration initial, Duration max) {
        return new ApnsTimingPolicy(connectTimeout, writeTimeout, pollInterval, deliveryGrace,
                initial, max, maxConnectAttempts, shutdownTimeout);
    }

    public ApnsTimingPolicy withMaxConnectAttempts(int attempts) {
        return new ApnsTimingPolicy(connectTimeout, writeTimeout, pollInterval, deliveryGrace,
                reconnectInitialDelay, reconnectMaxDelay, attempts, shutdownTimeout);
    }

    public ApnsTimingPolicy withShutdownTimeout(Duration timeout) {
        return new ApnsTimingPolicy(connectTimeout, writeTimeout, pollInterval, deliveryGrace,
                reconnectInitialDelay, reconnectMaxDelay, maxConnectAttempts, timeout);
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
