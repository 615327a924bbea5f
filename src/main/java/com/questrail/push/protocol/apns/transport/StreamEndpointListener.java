package com.questrail.push.protocol.apns.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner by the
 * implementation, and every {@link #onBytes(byte[])} for a connection must be
 * delivered before its {@link #onClosed(Throwable)}. Netty endpoints satisfy
 * both by calling back on the channel's event loop.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called when bytes are read from the stream.
     *
     * <p>Chunk boundaries carry no meaning: a frame may be split across calls
     * and one call may carry several frames.</p>
     */
    void onBytes(byte[] bytes);

    /**
     * Called at most once, when the stream stops being usable after a
     * successful connect.
     *
     * @param cause the transport failure, or {@code null} for an orderly close
     */
    void onClosed(Throwable cause);
}
