package com.questrail.push.protocol.apns.internal.connection;

import com.questrail.push.protocol.apns.model.ErrorResponse;
import com.questrail.push.protocol.apns.model.Notification;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * How one connection incarnation ended, and what must happen to the
 * notifications it still held.
 *
 * <p>Every outcome carries a replay list: notifications whose delivery is
 * unknown and that must be sent again, in their original order, ahead of any
 * fresh work.</p>
 */
public sealed interface ConnectionOutcome
        permits ConnectionOutcome.ErrorReported,
                ConnectionOutcome.ServerShutdown,
                ConnectionOutcome.ClosedWithoutError,
                ConnectionOutcome.Settled
{
    List<Notification> replay();

    /**
     * The gateway rejected a notification and closed the connection.
     *
     * @param failed the rejected notification, or empty if its identifier was
     *               no longer in the replay window
     */
    record ErrorReported(ErrorResponse response,
                         Optional<Notification> failed,
                         List<Notification> replay) implements ConnectionOutcome
    {
        public ErrorReported {
            Objects.requireNonNull(response, "response");
            Objects.requireNonNull(failed, "failed");
            replay = List.copyOf(replay);
        }
    }

    /**
     * The gateway closed for maintenance after processing
     * {@code lastIdentifier} successfully.
     */
    record ServerShutdown(int lastIdentifier, List<Notification> replay) implements ConnectionOutcome
    {
        public ServerShutdown {
            replay = List.copyOf(replay);
        }
    }

    /**
     * The stream closed, or failed, without a readable error frame.
     *
     * @param cause transport failure, or {@code null} for an orderly close
     */
    record ClosedWithoutError(List<Notification> replay, Throwable cause) implements ConnectionOutcome
    {
        public ClosedWithoutError {
            replay = List.copyOf(replay);
        }
    }

    /**
     * The client ended the connection itself and no error frame arrived within
     * the delivery grace period, so every outstanding notification is
     * presumed delivered.
     */
    record Settled(int presumedDelivered, SettleReason reason) implements ConnectionOutcome
    {
        public Settled {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public List<Notification> replay() {
            return List.of();
        }
    }

    enum SettleReason
    {
        /** The replay window could not admit another notification. */
        WINDOW_FULL,
        /** The queue was shut down or the worker was interrupted. */
        SHUTDOWN_REQUESTED
    }
}
