package com.questrail.push.protocol.apns.codec.impl;

import com.questrail.push.protocol.apns.codec.ApnsFrameDecoder;
import com.questrail.push.protocol.apns.codec.MalformedFrameException;
import com.questrail.push.protocol.apns.model.ErrorResponse;
import com.questrail.push.protocol.apns.model.Feedback;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

import static com.questrail.push.protocol.apns.codec.impl.ApnsWireFormat.COMMAND_ERROR_RESPONSE;
import static com.questrail.push.protocol.apns.codec.impl.ApnsWireFormat.ERROR_FRAME_LENGTH;

/**
 * DefaultApnsFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ApnsFrameDecoder}.
 *
 * <p>Error frames are fixed-size, so decoding is a length check, a command tag
 * check and two field reads. Feedback streams are decoded lazily: the returned
 * {@link Iterable} walks the input on demand and never copies more than one
 * token at a time.</p>
 */
public final class DefaultApnsFrameDecoder implements ApnsFrameDecoder
{
    @Override
    public ErrorResponse decodeError(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        if (frame.length != ERROR_FRAME_LENGTH) {
            throw new MalformedFrameException(
                    "error frame must be " + ERROR_FRAME_LENGTH + " bytes, got " + frame.length);
        }

        final int command = frame[0] & 0xFF;
        if (command != COMMAND_ERROR_RESPONSE) {
            throw new MalformedFrameException("unexpected command tag " + command + " in error frame");
        }

        ByteBuffer buf = ByteBuffer.wrap(frame);
        final int status = buf.get(1) & 0xFF;
        final int identifier = buf.getInt(2);

        return new ErrorResponse(status, identifier);
    }

    @Override
    public Iterable<Feedback> decodeFeedback(byte[] stream)
    {
        Objects.requireNonNull(stream, "stream");
        final byte[] input = stream.clone();
        return () -> new FeedbackIterator(ByteBuffer.wrap(input));
    }

    /**
     * One pass over a feedback stream. Fails at the first truncated record.
     */
    private static final class FeedbackIterator implements Iterator<Feedback>
    {
        private final ByteBuffer buf;

        private FeedbackIterator(ByteBuffer buf)
        {
            this.buf = buf;
        }

        @Override
        public boolean hasNext()
        {
            return buf.hasRemaining();
        }

        @Override
        public Feedback next()
        {
            if (!buf.hasRemaining()) {
                throw new NoSuchElementException();
            }

            Feedback record = FeedbackStreamDecoder.readRecord(buf);
            if (record == null) {
                throw new MalformedFrameException(
                        "truncated feedback record at offset " + buf.position());
            }
            return record;
        }
    }
}
