package com.questrail.push.protocol.apns.internal.queue;

import com.questrail.push.protocol.apns.internal.connection.NotificationSource;
import com.questrail.push.protocol.apns.model.Notification;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * NotificationQueue
 * =============================================================================
 * Unbounded FIFO of notifications awaiting transmission, shared by every
 * connection of a client.
 *
 * <h2>Producers</h2>
 * <ul>
 *   <li>{@link #enqueue(Notification)}: fresh work, appended at the tail.
 *       Never blocks.</li>
 *   <li>{@link #enqueueFront(List)}: replay after a connection ended, placed
 *       ahead of everything already queued with the list's order kept.</li>
 * </ul>
 *
 * <h2>Consumers</h2>
 * A consumer takes a notification with {@link #take()} or {@link #poll(Duration)}
 * and then finishes it with {@link #markProcessed(Notification)} or gives it
 * back with {@link #requeue(Notification)}. Until then the notification counts
 * as <em>in flight</em>, and {@link #drain()} keeps waiting.
 *
 * <h2>Shutdown</h2>
 * After {@link #shutdown()} fresh work is rejected, consumers stop receiving
 * notifications, and blocked callers return. Replay is still accepted so that
 * {@link #removeAll()} can hand it back to the application.
 */
public final class NotificationQueue implements NotificationSource
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition settled = lock.newCondition();

    private final Deque<Notification> items = new ArrayDeque<>();
    private int inFlight;
    private boolean shutdown;

    /**
     * Append a notification at the tail.
     *
     * @throws IllegalStateException if the queue has been shut down
     */
    public void enqueue(Notification notification)
    {
        Objects.requireNonNull(notification, "notification");
        lock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("queue is shut down");
            }
            items.addLast(notification);
            notEmpty.signal();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Place notifications ahead of everything queued, preserving their order.
     */
    public void enqueueFront(List<Notification> notifications)
    {
        Objects.requireNonNull(notifications, "notifications");
        if (notifications.isEmpty()) {
            return;
        }

        lock.lock();
        try {
            ListIterator<Notification> it = notifications.listIterator(notifications.size());
            while (it.hasPrevious()) {
                items.addFirst(Objects.requireNonNull(it.previous(), "notification"));
            }
            notEmpty.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Block until a notification is available.
     *
     * @return the notification, or empty once the queue is shut down
     */
    public Optional<Notification> take() throws InterruptedException
    {
        lock.lock();
        try {
            while (items.isEmpty() && !shutdown) {
                notEmpty.await();
            }
            return takeLocked();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Notification> poll(Duration timeout) throws InterruptedException
    {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (items.isEmpty() && !shutdown) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return takeLocked();
        }
        finally {
            lock.unlock();
        }
    }

    private Optional<Notification> takeLocked()
    {
        if (shutdown) {
            return Optional.empty();
        }
        Notification next = items.pollFirst();
        inFlight++;
        return Optional.of(next);
    }

    /**
     * Wait until there is work, without taking it.
     *
     * @return {@code true} if work is queued, {@code false} on timeout or shutdown
     */
    public boolean awaitAvailable(Duration timeout) throws InterruptedException
    {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (items.isEmpty() && !shutdown) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return !shutdown;
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void markProcessed(Notification notification)
    {
        lock.lock();
        try {
            finishLocked();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void requeue(Notification notification)
    {
        Objects.requireNonNull(notification, "notification");
        lock.lock();
        try {
            items.addFirst(notification);
            finishLocked();
            notEmpty.signal();
        }
        finally {
            lock.unlock();
        }
    }

    private void finishLocked()
    {
        if (inFlight == 0) {
            throw new IllegalStateException("no notification is in flight");
        }
        inFlight--;
        signalIfSettledLocked();
    }

    private void signalIfSettledLocked()
    {
        if (items.isEmpty() && inFlight == 0) {
            settled.signalAll();
        }
    }

    /**
     * Block until the queue is empty and nothing taken from it is still being
     * processed, or until the queue is shut down.
     */
    public void drain() throws InterruptedException
    {
        lock.lock();
        try {
            while (!isSettledLocked() && !shutdown) {
                settled.await();
            }
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Bounded variant of {@link #drain()}.
     *
     * @return {@code true} if the queue settled, {@code false} on timeout or shutdown
     */
    public boolean drain(Duration timeout) throws InterruptedException
    {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (!isSettledLocked()) {
                if (shutdown || nanos <= 0) {
                    return false;
                }
                nanos = settled.awaitNanos(nanos);
            }
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    private boolean isSettledLocked()
    {
        return items.isEmpty() && inFlight == 0;
    }

    /**
     * Reject further fresh work and release every blocked caller.
     */
    public void shutdown()
    {
        lock.lock();
        try {
            shutdown = true;
            notEmpty.signalAll();
            settled.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isShutdown()
    {
        lock.lock();
        try {
            return shutdown;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Remove and return everything queued, head first.
     */
    public List<Notification> removeAll()
    {
        lock.lock();
        try {
            List<Notification> abandoned = new ArrayList<>(items);
            items.clear();
            signalIfSettledLocked();
            return abandoned;
        }
        finally {
            lock.unlock();
        }
    }

    public int size()
    {
        lock.lock();
        try {
            return items.size();
        }
        finally {
            lock.unlock();
        }
    }

    public int inFlight()
    {
        lock.lock();
        try {
            return inFlight;
        }
        finally {
            lock.unlock();
        }
    }
}
