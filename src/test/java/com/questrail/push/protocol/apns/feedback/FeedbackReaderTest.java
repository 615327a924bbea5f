package com.questrail.push.protocol.apns.feedback;

import com.questrail.push.protocol.apns.codec.MalformedFrameException;
import com.questrail.push.protocol.apns.config.ApnsEndpoint;
import com.questrail.push.protocol.apns.model.Feedback;
import com.questrail.push.protocol.apns.observability.ApnsErrorEvent;
import com.questrail.push.protocol.apns.observability.RecordingObservabilitySink;
import com.questrail.push.protocol.apns.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FeedbackReaderTest
 * -----------------------------------------------------------------------------
 * Reads against a scripted feedback service.
 */
final class FeedbackReaderTest {

    private static final ApnsEndpoint FEEDBACK = new ApnsEndpoint("feedback.test", 2196);

    private final FakeStreamEndpoint endpoint = new FakeStreamEndpoint(FEEDBACK);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<Feedback> received = new CopyOnWriteArrayList<>();

    private FeedbackReader reader() {
        return new FeedbackReader(FEEDBACK, endpoint, received::add, Duration.ofSeconds(1), sink);
    }

    private static byte[] record(long epochSeconds, byte[] token) {
        return ByteBuffer.allocate(6 + token.length)
            .putInt((int) epochSeconds)
            .putShort((short) token.length)
            .put(token)
            .array();
    }

    private static Throwable failureOf(CompletableFuture<Integer> result) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void deliversRecordsAndCountsThemOnClose() throws Exception {
        CompletableFuture<Integer> result = reader().start();

        byte[] a = record(1_700_000_000L, new byte[] { 1, 2, 3 });
        byte[] b = record(1_700_000_005L, new byte[] { 4, 5 });
        byte[] stream = ByteBuffer.allocate(a.length + b.length).put(a).put(b).array();

        endpoint.injectBytes(Arrays.copyOfRange(stream, 0, 5));
        assertTrue(received.isEmpty());
        endpoint.injectBytes(Arrays.copyOfRange(stream, 5, stream.length));
        assertEquals(2, received.size());
        assertFalse(result.isDone(), "the service decides when the stream ends");

        endpoint.injectClose(null);

        assertEquals(2, result.get(1, TimeUnit.SECONDS));
        assertEquals("010203", received.get(0).tokenHex());
        assertEquals(Instant.ofEpochSecond(1_700_000_005L), received.get(1).when());
    }

    @Test
    void emptyStreamIsANormalResult() throws Exception {
        CompletableFuture<Integer> result = reader().start();

        endpoint.injectClose(null);

        assertEquals(0, result.get(1, TimeUnit.SECONDS));
        assertTrue(received.isEmpty());
    }

    @Test
    void streamEndingInsideARecordFails() {
        CompletableFuture<Integer> result = reader().start();

        endpoint.injectBytes(record(1L, new byte[] { 9 }));
        endpoint.injectBytes(new byte[] { 0, 0, 0, 2, 0, 4, 1 });
        endpoint.injectClose(null);

        assertInstanceOf(MalformedFrameException.class, failureOf(result));
        assertEquals(1, received.size(), "records already delivered stay delivered");
        assertTrue(sink.hasEventOfType(ApnsErrorEvent.class));
    }

    @Test
    void transportFailureFailsTheRead() {
        CompletableFuture<Integer> result = reader().start();
        IOException reset = new IOException("connection reset");

        endpoint.injectClose(reset);

        assertSame(reset, failureOf(result));
    }

    @Test
    void connectFailureFailsTheRead() {
        endpoint.failConnect(new IOException("connection refused"));

        CompletableFuture<Integer> result = reader().start();

        assertInstanceOf(IOException.class, failureOf(result));
    }

    @Test
    void throwingCallbackFailsTheReadAndClosesTheStream() {
        FeedbackReader reader = new FeedbackReader(FEEDBACK, endpoint, feedback -> {
            throw new IllegalStateException("callback bug");
        }, Duration.ofSeconds(1), sink);
        CompletableFuture<Integer> result = reader.start();

        endpoint.injectBytes(record(1L, new byte[] { 9 }));

        assertInstanceOf(IllegalStateException.class, failureOf(result));
        assertFalse(endpoint.isOpen());
    }
}
