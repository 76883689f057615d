package com.tyron.markj.core.concurrent;

import com.tyron.markj.api.concurrent.Debouncer;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Debouncer} backed by a caller-owned {@link ScheduledExecutorService}.
 *
 * The executor stands in for the event loop that owns the debounced state and must be
 * single-threaded. A generation counter guarantees that an action replaced by a newer
 * {@link #schedule(Runnable)} never runs, even if its timer already fired.
 */
public final class ExecutorDebouncer implements Debouncer {

    private static final Logger LOG = Logger.getLogger(ExecutorDebouncer.class.getName());

    private final ScheduledExecutorService executor;
    private final long delayMillis;

    private final Object lock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private ScheduledFuture<?> pending;
    private boolean disposed;

    public ExecutorDebouncer(ScheduledExecutorService executor, long delayMillis) {
        this.executor = Objects.requireNonNull(executor, "executor");
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis < 0: " + delayMillis);
        }
        this.delayMillis = delayMillis;
    }

    @Override
    public void schedule(Runnable action) {
        Objects.requireNonNull(action, "action");
        synchronized (lock) {
            if (disposed) {
                return;
            }
            long gen = generation.incrementAndGet();
            if (pending != null) {
                pending.cancel(false);
            }
            pending = executor.schedule(() -> runIfCurrent(gen, action), delayMillis, TimeUnit.MILLISECONDS);
        }
    }

    private void runIfCurrent(long gen, Runnable action) {
        synchronized (lock) {
            if (generation.get() != gen || disposed) {
                return;
            }
            pending = null;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Debounced action failed", e);
            throw e;
        }
    }

    @Override
    public void cancel() {
        synchronized (lock) {
            generation.incrementAndGet();
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
    }

    @Override
    public boolean isPending() {
        synchronized (lock) {
            return pending != null && !pending.isDone();
        }
    }

    @Override
    public void dispose() {
        cancel();
        synchronized (lock) {
            disposed = true;
        }
    }
}
