/**
 * APNs Codec: Wire-Level Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the APNs binary
 * interface. The codec layer implements the vendor wire format and nothing
 * else:</p>
 *
 * <ul>
 *   <li>Item-framed notification records (command 2)</li>
 *   <li>Fixed 6-byte error-response frames (command 8)</li>
 *   <li>The feedback stream: repeating {@code timestamp, length, token} records</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Notification
 *        → ApnsFrameEncoder      (size limits checked here)
 *            → byte[]            → StreamEndpoint.write(...)
 *
 *   StreamEndpointListener.onBytes(...)
 *        → ApnsFrameDecoder      (structure checked here)
 *            → ErrorResponse / Feedback
 *                → connection state machine / feedback reader
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>No I/O and no mutable state; every codec type is safe to share.</li>
 *   <li>Error meaning (replay, reporting) is decided by the connection, not here.</li>
 *   <li>Decode failures are connection-fatal and never retried by the codec.</li>
 * </ul>
 */
package com.questrail.push.protocol.apns.codec;
