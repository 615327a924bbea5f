package com.questrail.push.protocol.apns.codec;

import com.questrail.push.protocol.apns.model.ErrorResponse;
import com.questrail.push.protocol.apns.model.Feedback;

/**
 * ApnsFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for the two kinds of inbound data the protocol defines.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating frame-level structure</li>
 *   <li>Detecting truncation or a foreign command tag</li>
 *   <li>Constructing model values on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Deciding what an error means for in-flight notifications</li>
 *   <li>Reading from a socket or buffering across reads</li>
 * </ul>
 *
 * <p>A {@link MalformedFrameException} from either method is connection-fatal:
 * callers close the connection rather than retrying the decode.</p>
 */
public interface ApnsFrameDecoder
{
    /**
     * Decode a fixed-size error-response frame.
     *
     * <p>Unrecognized status bytes are not a decode failure; they surface as
     * {@code ProtocolError.UNKNOWN} through {@link ErrorResponse#error()}.</p>
     *
     * @param frame exactly one error frame
     * @return the status and identifier carried by the frame
     * @throws MalformedFrameException if the frame has the wrong size or command tag
     */
    ErrorResponse decodeError(byte[] frame);

    /**
     * Decode a complete feedback stream.
     *
     * <p>The returned sequence is lazy. Each call to {@code iterator()} starts
     * again from the first record; a truncated trailing record raises
     * {@link MalformedFrameException} when the iterator reaches it.</p>
     *
     * @param stream every byte read from the feedback connection
     * @return the feedback records in stream order
     */
    Iterable<Feedback> decodeFeedback(byte[] stream);
}
