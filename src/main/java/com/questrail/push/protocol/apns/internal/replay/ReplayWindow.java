package com.questrail.push.protocol.apns.internal.replay;

import com.questrail.push.protocol.apns.internal.time.MonotonicClock;
import com.questrail.push.protocol.apns.model.Notification;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ReplayWindow
 * =============================================================================
 * Notifications sent on one connection whose fate is not yet known.
 *
 * <p>The gateway never acknowledges a notification. It reports only the first
 * failure, by identifier, and then closes the connection. Everything sent
 * after the failed notification was discarded by the gateway and has to be
 * sent again; everything sent before it was accepted. This window keeps the
 * sent notifications in send order so that the split can be made.</p>
 *
 * <h2>Ordering</h2>
 * Entries are ordered by insertion, never by identifier. Identifiers may wrap
 * around the 32-bit range without affecting which entries count as "after".
 *
 * <h2>Bound</h2>
 * The window holds at most {@code capacity} entries. {@link #offer(Notification)}
 * refuses further entries when full, which makes the connection stop sending
 * and settle instead of growing the window.
 *
 * <h2>Delivery grace</h2>
 * An entry that has been in the window for longer than the delivery grace
 * period without an error is presumed delivered and removed from the head by
 * {@link #purgeExpired()}.
 *
 * <h2>Thread Safety</h2>
 * All methods are synchronized; the send duty and the read duty of a
 * connection use the same window.
 */
public final class ReplayWindow
{
    private final int capacity;
    private final long graceNanos;
    private final MonotonicClock clock;

    private final LinkedHashMap<Integer, Entry> entries = new LinkedHashMap<>();

    public ReplayWindow(int capacity, Duration deliveryGrace, MonotonicClock clock)
    {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.graceNanos = Objects.requireNonNull(deliveryGrace, "deliveryGrace").toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Admit a notification that is about to be written.
     *
     * @return {@code false} if the window is full or the identifier is already
     *         in the window; the notification was not admitted
     */
    public synchronized boolean offer(Notification notification)
    {
        Objects.requireNonNull(notification, "notification");
        purgeExpired();

        if (entries.size() >= capacity || entries.containsKey(notification.identifier())) {
            return false;
        }
        entries.put(notification.identifier(), new Entry(notification, clock.nowNanos()));
        return true;
    }

    /**
     * Partition the window around {@code identifier}. The window is not modified.
     */
    public synchronized ReplaySplit split(int identifier)
    {
        if (!entries.containsKey(identifier)) {
            return new ReplaySplit(0, Optional.empty(), notificationsLocked(), false);
        }

        int confirmed = 0;
        Notification failed = null;
        List<Notification> replay = new ArrayList<>();

        for (Map.Entry<Integer, Entry> e : entries.entrySet()) {
            if (failed != null) {
                replay.add(e.getValue().notification());
            }
            else if (e.getKey() == identifier) {
                failed = e.getValue().notification();
            }
            else {
                confirmed++;
            }
        }
        return new ReplaySplit(confirmed, Optional.of(failed), replay, true);
    }

    /**
     * Entries sent after {@code identifier}, or the whole window if it is not
     * present. The window is not modified.
     */
    public synchronized List<Notification> replayAfter(int identifier)
    {
        return split(identifier).replay();
    }

    /**
     * Remove and return every entry, oldest first.
     */
    public synchronized List<Notification> drainAll()
    {
        List<Notification> all = notificationsLocked();
        entries.clear();
        return all;
    }

    /**
     * Remove entries whose delivery grace has elapsed.
     *
     * @return number of entries presumed delivered
     */
    public synchronized int purgeExpired()
    {
        final long now = clock.nowNanos();
        int purged = 0;

        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            Entry head = it.next();
            if (now - head.sentAtNanos() < graceNanos) {
                break;
            }
            it.remove();
            purged++;
        }
        return purged;
    }

    public synchronized void clear()
    {
        entries.clear();
    }

    public synchronized int size()
    {
        return entries.size();
    }

    public synchronized boolean isEmpty()
    {
        return entries.isEmpty();
    }

    public int capacity()
    {
        return capacity;
    }

    private List<Notification> notificationsLocked()
    {
        List<Notification> all = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) {
            all.add(e.notification());
        }
        return all;
    }

    private record Entry(Notification notification, long sentAtNanos) {}
}
