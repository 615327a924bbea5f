package com.questrail.push.protocol.apns.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ApnsTimingPolicyTest
 * -----------------------------------------------------------------------------
 * Verifies ApnsTimingPolicy defaults and validation.
 */
final class ApnsTimingPolicyTest {

    @Test
    void defaultsMatchProductionGateway() {
        ApnsTimingPolicy policy = ApnsTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(10), policy.connectTimeout());
        assertEquals(Duration.ofSeconds(10), policy.writeTimeout());
        assertEquals(Duration.ofMillis(100), policy.pollInterval());
        assertEquals(Duration.ofSeconds(5), policy.deliveryGrace());
        assertEquals(Duration.ofMillis(100), policy.reconnectInitialDelay());
        assertEquals(Duration.ofSeconds(30), policy.reconnectMaxDelay());
        assertEquals(5, policy.maxConnectAttempts());
        assertEquals(Duration.ofSeconds(10), policy.shutdownTimeout());
        assertTrue(policy.shutdownTimeout().compareTo(policy.deliveryGrace()) > 0);
    }

    @Test
    void withersReplaceOnlyTheirField() {
        ApnsTimingPolicy policy = ApnsTimingPolicy.defaults()
            .withDeliveryGrace(Duration.ofMillis(250))
            .withPollInterval(Duration.ofMillis(5))
            .withReconnectDelays(Duration.ofMillis(1), Duration.ofMillis(8))
            .withMaxConnectAttempts(2);

        assertEquals(Duration.ofMillis(250), policy.deliveryGrace());
        assertEquals(Duration.ofMillis(5), policy.pollInterval());
        assertEquals(Duration.ofMillis(1), policy.reconnectInitialDelay());
        assertEquals(Duration.ofMillis(8), policy.reconnectMaxDelay());
        assertEquals(2, policy.maxConnectAttempts());
        assertEquals(Duration.ofSeconds(10), policy.connectTimeout());
    }

    @Test
    void zeroGraceIsAllowed() {
        assertEquals(Duration.ZERO, ApnsTimingPolicy.defaults().withDeliveryGrace(Duration.ZERO).deliveryGrace());
    }

    @Test
    void rejectsInvalidValues() {
        ApnsTimingPolicy d = ApnsTimingPolicy.defaults();

        assertThrows(IllegalArgumentException.class, () -> d.withPollInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> d.withDeliveryGrace(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> d.withReconnectDelays(Duration.ofSeconds(2), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> d.withMaxConnectAttempts(0));
        assertThrows(NullPointerException.class, () -> d.withDeliveryGrace(null));
    }

    @Test
    void stopBudgetMustOutlastTheDeliveryGrace() {
        ApnsTimingPolicy d = ApnsTimingPolicy.defaults();

        assertThrows(IllegalArgumentException.class, () -> d.withShutdownTimeout(d.deliveryGrace()));
        assertThrows(IllegalArgumentException.class, () -> d.withDeliveryGrace(Duration.ofSeconds(30)));

        ApnsTimingPolicy longGrace = d.withShutdownTimeout(Duration.ofSeconds(60))
            .withDeliveryGrace(Duration.ofSeconds(30));
        assertEquals(Duration.ofSeconds(30), longGrace.deliveryGrace());
    }
}
