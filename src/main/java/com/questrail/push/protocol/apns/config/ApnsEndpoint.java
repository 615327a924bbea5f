package com.questrail.push.protocol.apns.config;

import java.util.Objects;

/**
 * Host and port of a gateway or feedback service.
 */
public record ApnsEndpoint(String host, int port) {

    public ApnsEndpoint {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
