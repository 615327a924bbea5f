package com.questrail.push.protocol.apns.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class ApnsClientConfigTest {

    @Test
    void defaultsToProductionWithOneConnection() {
        ApnsClientConfig config = ApnsClientConfig.builder().build();

        assertEquals(new ApnsEndpoint("gateway.push.apple.com", 2195), config.gateway());
        assertEquals(new ApnsEndpoint("feedback.push.apple.com", 2196), config.feedback());
        assertEquals(1, config.connectionCount());
        assertEquals(ApnsClientConfig.DEFAULT_REPLAY_WINDOW_CAPACITY, config.replayWindowCapacity());
        assertFalse(config.usesTls());
    }

    @Test
    void sandboxSelectsBothSandboxHosts() {
        ApnsClientConfig config = ApnsClientConfig.builder()
            .withEnvironment(ApnsEnvironment.SANDBOX)
            .withCredentials(ApnsCredentials.of(Path.of("chain.pem"), Path.of("key.pem")))
            .build();

        assertEquals("gateway.sandbox.push.apple.com:2195", config.gateway().toString());
        assertEquals("feedback.sandbox.push.apple.com:2196", config.feedback().toString());
        assertTrue(config.usesTls());
    }

    @Test
    void rejectsInvalidCounts() {
        assertThrows(IllegalArgumentException.class,
            () -> ApnsClientConfig.builder().withConnectionCount(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> ApnsClientConfig.builder().withReplayWindowCapacity(0).build());
    }

    @Test
    void endpointValidatesHostAndPort() {
        assertThrows(IllegalArgumentException.class, () -> new ApnsEndpoint(" ", 2195));
        assertThrows(IllegalArgumentException.class, () -> new ApnsEndpoint("localhost", 0));
        assertThrows(IllegalArgumentException.class, () -> new ApnsEndpoint("localhost", 65536));
    }

    @Test
    void credentialsDoNotPrintThePassword() {
        ApnsCredentials credentials =
            new ApnsCredentials(Path.of("chain.pem"), Path.of("key.pem"), "secret", null);

        assertFalse(credentials.toString().contains("secret"));
    }
}
