package com.questrail.push.protocol.apns.config;

import com.questrail.push.protocol.apns.internal.exec.ApnsTimingPolicy;

import java.util.Objects;

/**
 * Aggregated configuration for a push client.
 *
 * <p>{@code credentials} may be {@code null}, in which case connections are
 * made without TLS. That is only useful against a local test gateway.</p>
 */
public record ApnsClientConfig(
    ApnsEndpoint gateway,
    ApnsEndpoint feedback,
    ApnsCredentials credentials,
    int connectionCount,
    int replayWindowCapacity,
    ApnsTimingPolicy timingPolicy
) {
    public static final int DEFAULT_REPLAY_WINDOW_CAPACITY = 10_000;

    public ApnsClientConfig {
        Objects.requireNonNull(gateway, "gateway");
        Objects.requireNonNull(feedback, "feedback");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (connectionCount < 1) {
            throw new IllegalArgumentException("connectionCount must be >= 1");
        }
        if (replayWindowCapacity < 1) {
            throw new IllegalArgumentException("replayWindowCapacity must be >= 1");
        }
    }

    public boolean usesTls() {
        return credentials != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ApnsEndpoint gateway = ApnsEnvironment.PRODUCTION.gateway();
        private ApnsEndpoint feedback = ApnsEnvironment.PRODUCTION.feedback();
        private ApnsCredentials credentials;
        private int connectionCount = 1;
        private int replayWindowCapacity = DEFAULT_REPLAY_WINDOW_CAPACITY;
        private ApnsTimingPolicy timingPolicy = ApnsTimingPolicy.defaults();

        public Builder withEnvironment(ApnsEnvironment environment) {
            this.gateway = environment.gateway();
            this.feedback = environment.feedback();
            return this;
        }

        public Builder withGateway(ApnsEndpoint gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder withFeedback(ApnsEndpoint feedback) {
            this.feedback = feedback;
            return this;
        }

        public Builder withCredentials(ApnsCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder withConnectionCount(int connectionCount) {
            this.connectionCount = connectionCount;
            return this;
        }

        public Builder withReplayWindowCapacity(int capacity) {
            this.replayWindowCapacity = capacity;
            return this;
        }

        public Builder withTimingPolicy(ApnsTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public ApnsClientConfig build() {
            return new ApnsClientConfig(gateway, feedback, credentials,
                    connectionCount, replayWindowCapacity, timingPolicy);
        }
    }
}
