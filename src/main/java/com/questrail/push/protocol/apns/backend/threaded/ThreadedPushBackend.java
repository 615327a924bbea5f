package com.questrail.push.protocol.apns.backend.threaded;

import com.questrail.push.api.DeliveryError;
import com.questrail.push.protocol.apns.backend.ApnsUnavailableException;
import com.questrail.push.protocol.apns.backend.BackendContext;
import com.questrail.push.protocol.apns.backend.PushBackend;
import com.questrail.push.protocol.apns.internal.exec.ConnectAttemptTracker;
import com.questrail.push.protocol.apns.internal.queue.NotificationQueue;
import com.questrail.push.protocol.apns.internal.time.MonotonicClock;
import com.questrail.push.protocol.apns.internal.time.SystemMonotonicClock;
import com.questrail.push.protocol.apns.internal.time.SystemWallClock;
import com.questrail.push.protocol.apns.model.Notification;
import com.questrail.push.protocol.apns.observability.ApnsErrorEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ThreadedPushBackend
 * =============================================================================
 * Reference {@link PushBackend}: one platform thread per gateway connection,
 * plus one thread for application callbacks.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>{@code apns-connection-<n>}: runs a {@link ConnectionWorker}, i.e. the
 *       send duty of successive connection incarnations.</li>
 *   <li>transport I/O threads: run the read duty of each connection.</li>
 *   <li>{@code apns-callbacks}: runs the error and fatal handlers, one at a
 *       time, so a slow handler never stalls sending.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   backend.start()        → starts connection threads and the callback thread
 *   backend.stop(timeout)  → shuts the queue, joins, interrupts stragglers
 * </pre>
 */
public final class ThreadedPushBackend implements PushBackend
{
    private final BackendContext context;
    private final NotificationQueue queue;
    private final MonotonicClock deadlines = SystemMonotonicClock.INSTANCE;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final List<ConnectionWorker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private final ExecutorService callbacks;

    public ThreadedPushBackend(BackendContext context)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.queue = context.queue();
        this.callbacks = Executors.newSingleThreadExecutor(r -> new Thread(r, "apns-callbacks"));

        ConnectAttemptTracker attempts = new ConnectAttemptTracker();
        for (int slot = 0; slot < context.config().connectionCount(); slot++) {
            workers.add(new ConnectionWorker(slot, context, attempts, this::notifyError, this::notifyFatal));
        }
    }

    @Override
    public void start()
    {
        if (stopped.get()) {
            throw new IllegalStateException("backend has been stopped");
        }
        if (started.compareAndSet(false, true)) {
            for (ConnectionWorker worker : workers) {
                Thread t = new Thread(worker, worker.name());
                threads.add(t);
                t.start();
            }
        }
    }

    @Override
    public List<Notification> stop()
    {
        return stop(context.config().timingPolicy().shutdownTimeout());
    }

    @Override
    public List<Notification> stop(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (!stopped.compareAndSet(false, true)) {
            return List.of();
        }

        queue.shutdown();
        final long deadline = deadlines.nowNanos() + timeout.toNanos();

        boolean interrupted = false;
        for (Thread t : threads) {
            try {
                TimeUnit.NANOSECONDS.timedJoin(t, Math.max(0, deadline - deadlines.nowNanos()));
            }
            catch (InterruptedException e) {
                interrupted = true;
                break;
            }
        }

        // Past the deadline: connections hand their windows back instead of settling.
        for (Thread t : threads) {
            if (t.isAlive()) {
                t.interrupt();
            }
        }
        for (Thread t : threads) {
            try {
                TimeUnit.SECONDS.timedJoin(t, 1);
            }
            catch (InterruptedException e) {
                interrupted = true;
            }
        }

        List<Notification> unsent = queue.removeAll();

        callbacks.shutdown();
        try {
            if (!callbacks.awaitTermination(1, TimeUnit.SECONDS)) {
                callbacks.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            callbacks.shutdownNow();
            interrupted = true;
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return unsent;
    }

    @Override
    public void notifyError(DeliveryError error)
    {
        Objects.requireNonNull(error, "error");
        dispatch(() -> context.errorHandler().accept(error), "error handler failed for " + error);
    }

    private void notifyFatal(ApnsUnavailableException fatal)
    {
        context.observabilitySink().onError(new ApnsErrorEvent(
                SystemWallClock.INSTANCE.now(), fatal.getMessage(), fatal));
        dispatch(() -> context.fatalHandler().accept(fatal), "fatal handler failed");
    }

    private void dispatch(Runnable callback, String failureMessage)
    {
        try {
            callbacks.execute(() -> {
                try {
                    callback.run();
                }
                catch (RuntimeException e) {
                    context.observabilitySink().onError(new ApnsErrorEvent(
                            SystemWallClock.INSTANCE.now(), failureMessage, e));
                }
            });
        }
        catch (RejectedExecutionException e) {
            // Callback thread already stopped; run on the reporting thread instead.
            callback.run();
        }
    }

    @Override
    public boolean awaitSettled(Duration timeout) throws InterruptedException
    {
        final long deadline = deadlines.nowNanos() + timeout.toNanos();
        final long pollMillis = Math.max(1, context.config().timingPolicy().pollInterval().toMillis());

        while (true) {
            long remaining = deadline - deadlines.nowNanos();
            if (!queue.drain(Duration.ofNanos(Math.max(0, remaining)))) {
                return false;
            }
            if (windowsEmpty() && queue.size() == 0 && queue.inFlight() == 0) {
                return true;
            }
            if (deadlines.nowNanos() >= deadline) {
                return false;
            }
            Thread.sleep(pollMillis);
        }
    }

    private boolean windowsEmpty()
    {
        for (ConnectionWorker worker : workers) {
            if (worker.outstanding() > 0) {
                return false;
            }
        }
        return true;
    }
}
