package com.questrail.push.protocol.apns.internal.replay;

import com.questrail.push.protocol.apns.model.Notification;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The replay window partitioned around the identifier named by an error frame.
 *
 * @param confirmed number of entries sent before the named one; delivered
 * @param failed    the named entry, if it was still in the window
 * @param replay    entries that must be resent, in send order
 * @param matched   whether the identifier was found; when it was not,
 *                  {@code replay} holds the whole window
 */
public record ReplaySplit(int confirmed, Optional<Notification> failed, List<Notification> replay, boolean matched) {

    public ReplaySplit {
        Objects.requireNonNull(failed, "failed");
        replay = List.copyOf(replay);
    }
}
