package com.tyron.markj.desktop;

import com.tyron.markj.api.concurrent.Debouncer;

import javax.swing.Timer;
import java.util.Objects;

/**
 * {@link Debouncer} on a non-repeating Swing {@link Timer}; actions run on the event dispatch thread.
 *
 * Must be used from the EDT.
 */
final class SwingTimerDebouncer implements Debouncer {

    private final Timer timer;
    private Runnable pending;

    SwingTimerDebouncer(long delayMillis) {
        timer = new Timer((int) Math.min(Integer.MAX_VALUE, delayMillis), e -> runPending());
        timer.setRepeats(false);
    }

    @Override
    public void schedule(Runnable action) {
        pending = Objects.requireNonNull(action, "action");
        timer.restart();
    }

    private void runPending() {
        Runnable action = pending;
        pending = null;
        if (action != null) {
            action.run();
        }
    }

    @Override
    public void cancel() {
        timer.stop();
        pending = null;
    }

    @Override
    public boolean isPending() {
        return pending != null;
    }

    @Override
    public void dispose() {
        cancel();
    }
}
