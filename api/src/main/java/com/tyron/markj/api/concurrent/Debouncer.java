package com.tyron.markj.api.concurrent;

import com.tyron.markj.api.service.Disposable;

/**
 * Restartable single-shot timer.
 *
 * Latest-only semantics: at most one action is pending; {@link #schedule(Runnable)} replaces (and
 * thereby cancels) the pending one and restarts the delay. Implementations run the action on the
 * thread that owns the debounced state (the UI event thread in the desktop app), so actions never
 * overlap.
 */
public interface Debouncer extends Disposable {

    void schedule(Runnable action);

    /**
     * Drops the pending action, if any.
     */
    void cancel();

    boolean isPending();
}
