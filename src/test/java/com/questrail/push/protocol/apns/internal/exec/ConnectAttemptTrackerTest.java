package com.questrail.push.protocol.apns.internal.exec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectAttemptTrackerTest {

    @Test
    void countsConsecutiveFailuresPerSlot() {
        ConnectAttemptTracker tracker = new ConnectAttemptTracker();

        assertEquals(1, tracker.recordFailure(0));
        assertEquals(2, tracker.recordFailure(0));
        assertEquals(1, tracker.recordFailure(1));

        assertEquals(2, tracker.failuresFor(0));
        assertEquals(1, tracker.failuresFor(1));
    }

    @Test
    void resetStartsTheCountAgain() {
        ConnectAttemptTracker tracker = new ConnectAttemptTracker();
        tracker.recordFailure(0);
        tracker.recordFailure(0);

        tracker.reset(0);

        assertEquals(0, tracker.failuresFor(0));
        assertEquals(1, tracker.recordFailure(0));
    }

    @Test
    void outageIsClaimedOnceUntilASlotConnects() {
        ConnectAttemptTracker tracker = new ConnectAttemptTracker();

        assertTrue(tracker.claimOutageReport());
        assertFalse(tracker.claimOutageReport());
        assertFalse(tracker.claimOutageReport());

        tracker.reset(2);

        assertTrue(tracker.claimOutageReport());
    }
}
