package com.questrail.push.protocol.apns.observability;

/**
 * Main interface for receiving push-engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on connection worker threads and on transport I/O
 * threads; implementations must be thread-safe and must not block.</p>
 */
public interface ApnsObservabilitySink {
    /**
     * Called when a connection changes state.
     * @param event the transition event details
     */
    void onStateTransition(ApnsStateTransitionEvent event);

    /**
     * Called when a connection incarnation ends.
     * @param event the outcome, including any replay set
     */
    void onConnectionOutcome(ApnsConnectionOutcomeEvent event);

    /**
     * Called for per-notification activity (sent, rejected locally, replayed).
     * @param event the protocol event
     */
    void onProtocolEvent(ApnsProtocolEvent event);

    /**
     * Called when a connect attempt succeeds or fails.
     * @param event the transport event
     */
    void onTransportEvent(ApnsTransportEvent event);

    /**
     * Called when an error or anomaly occurs in the engine.
     * @param event the error event
     */
    void onError(ApnsErrorEvent event);
}
