package com.tyron.markj.testFramework;

import com.tyron.markj.api.concurrent.Debouncer;

/**
 * {@link Debouncer} driven by the test: nothing runs until {@link #runPending()} is called.
 *
 * Counts how often the delay was restarted, so tests can assert that edits were coalesced.
 */
public final class ManualDebouncer implements Debouncer {

    private Runnable pending;
    private int scheduleCount;
    private int runCount;
    private boolean disposed;

    @Override
    public void schedule(Runnable action) {
        if (disposed) {
            throw new IllegalStateException("debouncer disposed");
        }
        pending = action;
        scheduleCount++;
    }

    @Override
    public void cancel() {
        pending = null;
    }

    @Override
    public boolean isPending() {
        return pending != null;
    }

    /**
     * Runs the pending action as if the delay had elapsed.
     *
     * @return false if nothing was pending
     */
    public boolean runPending() {
        Runnable action = pending;
        if (action == null) {
            return false;
        }
        pending = null;
        runCount++;
        action.run();
        return true;
    }

    public int getScheduleCount() {
        return scheduleCount;
    }

    public int getRunCount() {
        return runCount;
    }

    @Override
    public void dispose() {
        disposed = true;
        pending = null;
    }
}
