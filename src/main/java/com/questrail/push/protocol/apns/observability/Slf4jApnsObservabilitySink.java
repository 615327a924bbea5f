package com.questrail.push.protocol.apns.observability;

import com.questrail.push.protocol.apns.internal.connection.ConnectionOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ApnsObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jApnsObservabilitySink implements ApnsObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jApnsObservabilitySink.class);

    @Override
    public void onStateTransition(ApnsStateTransitionEvent event) {
        log.info("APNs {}: {} -> {}", event.connection(), event.oldState(), event.newState());
    }

    @Override
    public void onConnectionOutcome(ApnsConnectionOutcomeEvent event) {
        ConnectionOutcome outcome = event.outcome();
        if (outcome instanceof ConnectionOutcome.ErrorReported reported) {
            log.warn("APNs {}: gateway rejected {}; replaying {}",
                event.connection(), reported.response(), reported.replay().size());
        }
        else if (outcome instanceof ConnectionOutcome.ServerShutdown shutdown) {
            log.warn("APNs {}: gateway shutting down after id {}; replaying {}",
                event.connection(), Integer.toUnsignedString(shutdown.lastIdentifier()), shutdown.replay().size());
        }
        else if (outcome instanceof ConnectionOutcome.ClosedWithoutError closed) {
            log.warn("APNs {}: connection closed without error frame; replaying {}",
                event.connection(), closed.replay().size(), closed.cause());
        }
        else if (outcome instanceof ConnectionOutcome.Settled settled) {
            log.info("APNs {}: settled ({}); {} presumed delivered",
                event.connection(), settled.reason(), settled.presumedDelivered());
        }
    }

    @Override
    public void onProtocolEvent(ApnsProtocolEvent event) {
        log.debug("APNs {}: {} {}", event.connection(), event.kind(), event.detail());
    }

    @Override
    public void onTransportEvent(ApnsTransportEvent event) {
        if (event.kind() == ApnsTransportEvent.Kind.CONNECTED) {
            log.info("APNs {}: connected to {}", event.connection(), event.remote());
        }
        else {
            log.warn("APNs {}: connect to {} failed ({} consecutive)",
                event.connection(), event.remote(), event.consecutiveFailures(), event.cause());
        }
    }

    @Override
    public void onError(ApnsErrorEvent event) {
        log.error("APNs Error: {}", event.message(), event.cause());
    }
}
