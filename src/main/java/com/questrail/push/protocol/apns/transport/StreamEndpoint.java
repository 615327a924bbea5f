package com.questrail.push.protocol.apns.transport;

import java.util.concurrent.CompletableFuture;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one client-side byte stream (TCP, optionally under TLS).
 *
 * <p>An endpoint represents exactly one connection attempt. It is connected at
 * most once and is not reusable after it closes; reconnecting means asking the
 * {@link StreamEndpointFactory} for a fresh endpoint.</p>
 *
 * <p>Higher layers are responsible for:</p>
 * <ul>
 *   <li>encoding frames before {@link #write(byte[])}</li>
 *   <li>reassembling inbound bytes into frames</li>
 *   <li>deciding what a close means for in-flight notifications</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives inbound bytes and the close signal.
     *
     * <p>This must be called before {@link #connect()}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Open the connection, including the TLS handshake where one is configured.
     *
     * @return a future completed once the stream is usable, or completed
     *         exceptionally if the connection could not be established
     */
    CompletableFuture<Void> connect();

    /**
     * Write one complete frame.
     *
     * @return a future completed once the bytes have been handed to the socket
     */
    CompletableFuture<Void> write(byte[] frame);

    /**
     * Close the stream. Idempotent.
     */
    void close();

    boolean isOpen();
}
