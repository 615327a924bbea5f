package com.questrail.push.protocol.apns.codec.impl;

import com.questrail.push.protocol.apns.codec.MalformedFrameException;
import com.questrail.push.protocol.apns.model.Feedback;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.questrail.push.protocol.apns.codec.impl.ApnsWireFormat.FEEDBACK_HEADER_LENGTH;

/**
 * FeedbackStreamDecoder
 * -----------------------------------------------------------------------------
 * Incremental decoder for a live feedback stream.
 *
 * <p>The feedback service has no stream-level framing: records follow one
 * another until the gateway closes the connection. Reads from the socket do
 * not respect record boundaries, so this decoder keeps the unconsumed tail of
 * the previous chunk and prepends it to the next one.</p>
 *
 * <h2>Usage</h2>
 * <pre>
 *   decoder.feed(chunk)   → zero or more complete records, in stream order
 *   ...
 *   decoder.finish()      → on end of stream; fails if a partial record remains
 * </pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Transport adapters deliver reads serially, which is all
 * this class needs.</p>
 */
public final class FeedbackStreamDecoder
{
    private byte[] pending = new byte[0];

    /**
     * Append a chunk read from the stream and return every record it completes.
     */
    public List<Feedback> feed(byte[] chunk)
    {
        byte[] joined = Arrays.copyOf(pending, pending.length + chunk.length);
        System.arraycopy(chunk, 0, joined, pending.length, chunk.length);

        ByteBuffer buf = ByteBuffer.wrap(joined);
        List<Feedback> records = new ArrayList<>();
        Feedback record;
        while ((record = readRecord(buf)) != null) {
            records.add(record);
        }

        pending = Arrays.copyOfRange(joined, buf.position(), joined.length);
        return records;
    }

    /**
     * Signal end of stream.
     *
     * @throws MalformedFrameException if the stream ended inside a record
     */
    public void finish()
    {
        if (pending.length > 0) {
            throw new MalformedFrameException(
                    "feedback stream ended with " + pending.length + " bytes of a partial record");
        }
    }

    /** Number of buffered bytes that do not yet form a complete record. */
    public int pendingBytes()
    {
        return pending.length;
    }

    /**
     * Read one record from the buffer's position.
     *
     * @return the record, or {@code null} with the position unchanged if the
     *         buffer does not hold a complete record
     */
    static Feedback readRecord(ByteBuffer buf)
    {
        if (buf.remaining() < FEEDBACK_HEADER_LENGTH) {
            return null;
        }

        final int start = buf.position();
        final long timestamp = Integer.toUnsignedLong(buf.getInt(start));
        final int tokenLength = Short.toUnsignedInt(buf.getShort(start + 4));

        if (buf.remaining() < FEEDBACK_HEADER_LENGTH + tokenLength) {
            return null;
        }

        byte[] token = new byte[tokenLength];
        buf.position(start + FEEDBACK_HEADER_LENGTH);
        buf.get(token);

        return new Feedback(token, Instant.ofEpochSecond(timestamp));
    }
}
