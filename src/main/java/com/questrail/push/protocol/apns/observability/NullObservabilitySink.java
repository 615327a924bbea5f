package com.questrail.push.protocol.apns.observability;

/**
 * No-op implementation of ApnsObservabilitySink.
 */
public final class NullObservabilitySink implements ApnsObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ApnsStateTransitionEvent event) {}

    @Override
    public void onConnectionOutcome(ApnsConnectionOutcomeEvent event) {}

    @Override
    public void onProtocolEvent(ApnsProtocolEvent event) {}

    @Override
    public void onTransportEvent(ApnsTransportEvent event) {}

    @Override
    public void onError(ApnsErrorEvent event) {}
}
