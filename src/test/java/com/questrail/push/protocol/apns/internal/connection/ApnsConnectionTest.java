package com.questrail.push.protocol.apns.internal.connection;

import com.questrail.push.api.DeliveryError;
import com.questrail.push.protocol.apns.codec.MalformedFrameException;
import com.questrail.push.protocol.apns.codec.impl.DefaultApnsFrameDecoder;
import com.questrail.push.protocol.apns.codec.impl.DefaultApnsFrameEncoder;
import com.questrail.push.protocol.apns.config.ApnsEndpoint;
import com.questrail.push.protocol.apns.internal.connection.ConnectionOutcome.SettleReason;
import com.questrail.push.protocol.apns.internal.exec.ApnsTimingPolicy;
import com.questrail.push.protocol.apns.internal.queue.NotificationQueue;
import com.questrail.push.protocol.apns.internal.replay.ReplayWindow;
import com.questrail.push.protocol.apns.internal.time.SystemMonotonicClock;
import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.model.ProtocolError;
import com.questrail.push.protocol.apns.observability.ApnsConnectionOutcomeEvent;
import com.questrail.push.protocol.apns.observability.ApnsProtocolEvent;
import com.questrail.push.protocol.apns.observability.RecordingObservabilitySink;
import com.questrail.push.protocol.apns.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.questrail.push.protocol.apns.internal.connection.ConnectionState.*;
import static com.questrail.push.protocol.apns.model.NotificationFixtures.notification;
import static com.questrail.push.protocol.apns.model.NotificationFixtures.range;
import static com.questrail.push.protocol.apns.model.NotificationFixtures.withPayloadSize;
import static com.questrail.push.protocol.apns.transport.FakeStreamEndpoint.errorFrame;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ApnsConnectionTest
 * -----------------------------------------------------------------------------
 * One connection incarnation against a scripted gateway: how each way of
 * ending splits the replay window.
 */
class ApnsConnectionTest {

    private static final ApnsEndpoint GATEWAY = new ApnsEndpoint("gateway.test", 2195);
    private static final Duration WAIT = Duration.ofSeconds(2);

    private final NotificationQueue queue = new NotificationQueue();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<DeliveryError> localRejections = new CopyOnWriteArrayList<>();
    private final ExecutorService sender = Executors.newSingleThreadExecutor();

    private FakeStreamEndpoint endpoint;

    @AfterEach
    void tearDown() {
        queue.shutdown();
        sender.shutdownNow();
    }

    private ApnsConnection connection(int capacity, Duration grace) {
        ApnsTimingPolicy timing = ApnsTimingPolicy.defaults()
            .withPollInterval(Duration.ofMillis(5))
            .withDeliveryGrace(grace);
        endpoint = new FakeStreamEndpoint(GATEWAY);
        return new ApnsConnection(
            "apns-connection-0",
            GATEWAY,
            endpoint,
            new DefaultApnsFrameEncoder(),
            new DefaultApnsFrameDecoder(),
            new ReplayWindow(capacity, grace, SystemMonotonicClock.INSTANCE),
            timing,
            localRejections::add,
            sink);
    }

    private ApnsConnection openConnection() throws Exception {
        ApnsConnection c = connection(100, Duration.ofSeconds(5));
        c.open(WAIT);
        return c;
    }

    private Future<ConnectionOutcome> runAsync(ApnsConnection c) {
        return sender.submit(() -> c.run(queue));
    }

    private static ConnectionOutcome await(Future<ConnectionOutcome> outcome) throws Exception {
        return outcome.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static List<Integer> ids(List<Notification> notifications) {
        return notifications.stream().map(Notification::identifier).collect(Collectors.toList());
    }

    private static void awaitState(ApnsConnection c, ConnectionState expected) throws InterruptedException {
        final long deadline = System.nanoTime() + WAIT.toNanos();
        while (c.state() != expected) {
            if (System.nanoTime() > deadline) {
                fail("connection never reached " + expected + "; still " + c.state());
            }
            Thread.sleep(5);
        }
    }

    private Future<ConnectionOutcome> sendAll(ApnsConnection c, List<Notification> notifications) throws Exception {
        notifications.forEach(queue::enqueue);
        Future<ConnectionOutcome> outcome = runAsync(c);
        assertTrue(endpoint.awaitWritten(notifications.size(), WAIT), "frames written");
        return outcome;
    }

    // ---------------------------------------------------------------------
    // Connect
    // ---------------------------------------------------------------------

    @Test
    void openMovesThroughConnectingToReady() throws Exception {
        ApnsConnection c = openConnection();

        assertEquals(READY, c.state());
        assertEquals(List.of(CONNECTING, READY), sink.getStatesEntered());
        assertTrue(endpoint.isOpen());
    }

    @Test
    void failedConnectThrowsAndEndsDisconnected() {
        ApnsConnection c = connection(100, Duration.ofSeconds(5));
        endpoint.failConnect(new IOException("connection refused"));

        ApnsConnectException e = assertThrows(ApnsConnectException.class, () -> c.open(WAIT));

        assertEquals(GATEWAY, e.remote());
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(DISCONNECTED, c.state());
        assertEquals(List.of(CONNECTING, DISCONNECTED), sink.getStatesEntered());
    }

    @Test
    void runRequiresAnOpenConnection() {
        ApnsConnection c = connection(100, Duration.ofSeconds(5));

        assertThrows(IllegalStateException.class, () -> c.run(queue));
    }

    // ---------------------------------------------------------------------
    // Error frames
    // ---------------------------------------------------------------------

    @Test
    void permanentErrorReportsFailedAndReplaysLaterOnes() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 10));
        assertEquals(10, c.outstanding());

        endpoint.injectBytes(errorFrame(8, 5));

        ConnectionOutcome.ErrorReported outcome =
            assertInstanceOf(ConnectionOutcome.ErrorReported.class, await(future));
        assertEquals(ProtocolError.INVALID_TOKEN, outcome.response().error());
        assertEquals(5, outcome.failed().orElseThrow().identifier());
        assertEquals(List.of(6, 7, 8, 9, 10), ids(outcome.replay()));

        assertEquals(DISCONNECTED, c.state());
        assertEquals(List.of(CONNECTING, READY, DRAINING, DISCONNECTED), sink.getStatesEntered());
        assertFalse(endpoint.isOpen());
        assertEquals(5, c.outstanding());
        assertEquals(0, queue.inFlight());
        assertTrue(localRejections.isEmpty(), "gateway rejections are reported by the owner");
    }

    @Test
    void errorFrameSplitAcrossReadsIsReassembled() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 4));

        byte[] frame = errorFrame(8, 2);
        endpoint.injectBytes(Arrays.copyOfRange(frame, 0, 2));
        assertEquals(READY, c.state());
        endpoint.injectBytes(Arrays.copyOfRange(frame, 2, 6));

        ConnectionOutcome.ErrorReported outcome =
            assertInstanceOf(ConnectionOutcome.ErrorReported.class, await(future));
        assertEquals(2, outcome.failed().orElseThrow().identifier());
        assertEquals(List.of(3, 4), ids(outcome.replay()));
    }

    @Test
    void shutdownStatusReplaysLaterOnesWithoutAFailure() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 4));

        endpoint.injectBytes(errorFrame(10, 2));

        ConnectionOutcome.ServerShutdown outcome =
            assertInstanceOf(ConnectionOutcome.ServerShutdown.class, await(future));
        assertEquals(2, outcome.lastIdentifier());
        assertEquals(List.of(3, 4), ids(outcome.replay()));
    }

    @Test
    void unknownIdentifierReplaysTheWholeWindow() throws Exception {
        // The gateway named a notification the window no longer holds; nothing
        // can be presumed delivered, so everything is sent again.
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 3));

        endpoint.injectBytes(errorFrame(8, 99));

        ConnectionOutcome.ErrorReported outcome =
            assertInstanceOf(ConnectionOutcome.ErrorReported.class, await(future));
        assertTrue(outcome.failed().isEmpty());
        assertEquals(99, outcome.response().identifier());
        assertEquals(List.of(1, 2, 3), ids(outcome.replay()));
    }

    @Test
    void unreadableErrorFrameReplaysTheWholeWindow() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 2));

        endpoint.injectBytes(new byte[] { 0x09, 0x08, 0x00, 0x00, 0x00, 0x01 });

        ConnectionOutcome.ClosedWithoutError outcome =
            assertInstanceOf(ConnectionOutcome.ClosedWithoutError.class, await(future));
        assertEquals(List.of(1, 2), ids(outcome.replay()));
        assertInstanceOf(MalformedFrameException.class, outcome.cause());
    }

    // ---------------------------------------------------------------------
    // Close and write failure
    // ---------------------------------------------------------------------

    @Test
    void closeWithoutErrorReplaysTheWholeWindow() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 3));

        endpoint.injectClose(null);

        ConnectionOutcome.ClosedWithoutError outcome =
            assertInstanceOf(ConnectionOutcome.ClosedWithoutError.class, await(future));
        assertEquals(List.of(1, 2, 3), ids(outcome.replay()));
        assertNull(outcome.cause());
    }

    @Test
    void transportFailureIsCarriedAsCause() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 1));

        IOException reset = new IOException("connection reset");
        endpoint.injectClose(reset);

        ConnectionOutcome.ClosedWithoutError outcome =
            assertInstanceOf(ConnectionOutcome.ClosedWithoutError.class, await(future));
        assertSame(reset, outcome.cause());
        assertEquals(List.of(1), ids(outcome.replay()));
    }

    @Test
    void partialErrorFrameFollowedByCloseReplaysEverything() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 2));

        endpoint.injectBytes(new byte[] { 0x08, 0x08, 0x00 });
        endpoint.injectClose(null);

        ConnectionOutcome outcome = await(future);
        assertInstanceOf(ConnectionOutcome.ClosedWithoutError.class, outcome);
        assertEquals(List.of(1, 2), ids(outcome.replay()));
    }

    @Test
    void failedWriteEndsTheConnectionAndReplaysTheNotification() throws Exception {
        ApnsConnection c = openConnection();
        endpoint.failWrites(new IOException("broken pipe"));
        queue.enqueue(notification(1));

        ConnectionOutcome outcome = await(runAsync(c));

        assertInstanceOf(ConnectionOutcome.ClosedWithoutError.class, outcome);
        assertEquals(List.of(1), ids(outcome.replay()));
        assertEquals(0, queue.inFlight());
    }

    // ---------------------------------------------------------------------
    // Local rejection
    // ---------------------------------------------------------------------

    @Test
    void unencodableNotificationIsRejectedLocallyAndSkipped() throws Exception {
        ApnsConnection c = openConnection();
        queue.enqueue(notification(1));
        queue.enqueue(withPayloadSize(2, 2049));
        queue.enqueue(notification(3));
        Future<ConnectionOutcome> future = runAsync(c);

        assertTrue(endpoint.awaitWritten(2, WAIT));
        assertEquals(List.of(1, 3), endpoint.writtenIdentifiers());

        assertEquals(1, localRejections.size());
        DeliveryError rejected = localRejections.get(0);
        assertEquals(ProtocolError.INVALID_PAYLOAD_SIZE, rejected.error());
        assertEquals(2, rejected.notification().orElseThrow().identifier());
        assertEquals(1, sink.getProtocolEvents(ApnsProtocolEvent.Kind.REJECTED_LOCALLY).size());

        endpoint.injectClose(null);
        assertEquals(List.of(1, 3), ids(await(future).replay()));
    }

    // ---------------------------------------------------------------------
    // Settling
    // ---------------------------------------------------------------------

    @Test
    void fullWindowStopsSendingAndSettlesAfterGrace() throws Exception {
        ApnsConnection c = connection(3, Duration.ofMillis(100));
        c.open(WAIT);
        range(1, 10).forEach(queue::enqueue);

        ConnectionOutcome.Settled outcome =
            assertInstanceOf(ConnectionOutcome.Settled.class, await(runAsync(c)));

        assertEquals(SettleReason.WINDOW_FULL, outcome.reason());
        assertEquals(3, outcome.presumedDelivered());
        assertTrue(outcome.replay().isEmpty());
        assertEquals(List.of(1, 2, 3), endpoint.writtenIdentifiers());
        assertEquals(7, queue.size(), "the refused notification goes back to the head");
        assertEquals(0, queue.inFlight());
        assertEquals(1, sink.getProtocolEvents(ApnsProtocolEvent.Kind.WINDOW_FULL).size());
    }

    @Test
    void errorArrivingWhileDrainingIsStillHonoured() throws Exception {
        ApnsConnection c = connection(2, Duration.ofSeconds(5));
        c.open(WAIT);
        Future<ConnectionOutcome> future = sendAll(c, range(1, 2));
        queue.enqueue(notification(3));
        awaitState(c, DRAINING);

        endpoint.injectBytes(errorFrame(8, 1));

        ConnectionOutcome.ErrorReported outcome =
            assertInstanceOf(ConnectionOutcome.ErrorReported.class, await(future));
        assertEquals(1, outcome.failed().orElseThrow().identifier());
        assertEquals(List.of(2), ids(outcome.replay()));
        assertEquals(1, queue.size());
    }

    @Test
    void queueShutdownWithEmptyWindowSettlesImmediately() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = runAsync(c);

        queue.shutdown();

        ConnectionOutcome.Settled outcome =
            assertInstanceOf(ConnectionOutcome.Settled.class, await(future));
        assertEquals(SettleReason.SHUTDOWN_REQUESTED, outcome.reason());
        assertEquals(0, outcome.presumedDelivered());
        assertFalse(endpoint.isOpen());
    }

    @Test
    void queueShutdownWaitsOutTheGraceBeforePresumingDelivery() throws Exception {
        ApnsConnection c = connection(100, Duration.ofMillis(300));
        c.open(WAIT);
        Future<ConnectionOutcome> future = sendAll(c, range(1, 2));

        queue.shutdown();

        ConnectionOutcome.Settled outcome =
            assertInstanceOf(ConnectionOutcome.Settled.class, await(future));
        assertEquals(SettleReason.SHUTDOWN_REQUESTED, outcome.reason());
        assertTrue(outcome.replay().isEmpty());
        assertEquals(List.of(CONNECTING, READY, DRAINING, DISCONNECTED), sink.getStatesEntered());
    }

    @Test
    void interruptedSenderHandsTheWindowBack() throws Exception {
        ApnsConnection c = connection(2, Duration.ofSeconds(5));
        c.open(WAIT);
        Future<ConnectionOutcome> future = sendAll(c, range(1, 2));
        queue.enqueue(notification(3));
        awaitState(c, DRAINING);

        sender.shutdownNow();

        ConnectionOutcome.ClosedWithoutError outcome =
            assertInstanceOf(ConnectionOutcome.ClosedWithoutError.class, await(future));
        assertEquals(List.of(1, 2), ids(outcome.replay()));
        assertInstanceOf(InterruptedException.class, outcome.cause());
    }

    @Test
    void outcomeIsResolvedOnlyOnce() throws Exception {
        ApnsConnection c = openConnection();
        Future<ConnectionOutcome> future = sendAll(c, range(1, 3));

        endpoint.injectBytes(errorFrame(8, 2));
        endpoint.injectClose(new IOException("late"));
        endpoint.injectBytes(errorFrame(8, 3));

        ConnectionOutcome outcome = await(future);
        assertInstanceOf(ConnectionOutcome.ErrorReported.class, outcome);
        assertSame(outcome, c.outcome().join());
        assertEquals(1, sink.eventsOfType(ApnsConnectionOutcomeEvent.class).size());
    }
}
