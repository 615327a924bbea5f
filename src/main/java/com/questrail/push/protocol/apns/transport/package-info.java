/**
 * APNs Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty, java.nio, a test
 * double) and the connection state machine.
 *
 * <h2>Why these ports exist</h2>
 * Netty carries the production sockets and TLS, but Netty types must not leak
 * into the protocol core. Everything above the adapter sees only:
 * <ul>
 *   <li>Raw bytes as {@code byte[]}</li>
 *   <li>Completion as {@code CompletableFuture}</li>
 *   <li>A single close signal per connection</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no frame decoding)</li>
 *   <li>Not retry or reconnect on their own</li>
 *   <li>Not buffer writes beyond what the socket requires</li>
 * </ul>
 */
package com.questrail.push.protocol.apns.transport;
