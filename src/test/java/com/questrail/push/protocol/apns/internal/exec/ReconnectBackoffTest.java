package com.questrail.push.protocol.apns.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ReconnectBackoffTest {

    private final ReconnectBackoff backoff =
        new ReconnectBackoff(Duration.ofMillis(100), Duration.ofSeconds(1));

    @Test
    void noDelayBeforeTheFirstFailure() {
        assertEquals(Duration.ZERO, backoff.delayFor(0));
    }

    @Test
    void doublesPerConsecutiveFailureUpToTheCap() {
        assertEquals(Duration.ofMillis(100), backoff.delayFor(1));
        assertEquals(Duration.ofMillis(200), backoff.delayFor(2));
        assertEquals(Duration.ofMillis(400), backoff.delayFor(3));
        assertEquals(Duration.ofMillis(800), backoff.delayFor(4));
        assertEquals(Duration.ofSeconds(1), backoff.delayFor(5));
    }

    @Test
    void largeAttemptCountsDoNotOverflow() {
        assertEquals(Duration.ofSeconds(1), backoff.delayFor(1_000));
        assertEquals(Duration.ofSeconds(1), backoff.delayFor(Integer.MAX_VALUE));
    }

    @Test
    void zeroInitialDelayStaysZero() {
        ReconnectBackoff none = new ReconnectBackoff(Duration.ZERO, Duration.ofSeconds(1));
        assertEquals(Duration.ZERO, none.delayFor(10));
    }

    @Test
    void rejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class,
            () -> new ReconnectBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }

    @Test
    void followsTimingPolicy() {
        ReconnectBackoff fromPolicy = ReconnectBackoff.from(ApnsTimingPolicy.defaults());
        assertEquals(Duration.ofMillis(100), fromPolicy.delayFor(1));
        assertEquals(Duration.ofSeconds(30), fromPolicy.delayFor(20));
    }
}
