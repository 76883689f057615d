package com.tyron.markj.core.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutorDebouncerTest {

    private ScheduledExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    public void onlyLatestActionRuns() throws Exception {
        ExecutorDebouncer debouncer = new ExecutorDebouncer(executor, 100);
        List<String> ran = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        debouncer.schedule(() -> ran.add("first"));
        debouncer.schedule(() -> ran.add("second"));
        debouncer.schedule(() -> {
            ran.add("third");
            done.countDown();
        });
        assertTrue(debouncer.isPending());

        assertTrue(done.await(5, TimeUnit.SECONDS));
        // flush the executor queue so cancelled tasks had their chance
        executor.submit(() -> { }).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("third"), ran);
        assertFalse(debouncer.isPending());
    }

    @Test
    public void cancelDropsPendingAction() throws Exception {
        ExecutorDebouncer debouncer = new ExecutorDebouncer(executor, 50);
        List<String> ran = new CopyOnWriteArrayList<>();

        debouncer.schedule(() -> ran.add("x"));
        debouncer.cancel();
        assertFalse(debouncer.isPending());

        Thread.sleep(150);
        executor.submit(() -> { }).get(5, TimeUnit.SECONDS);
        assertTrue(ran.isEmpty());
    }

    @Test
    public void scheduleAfterDisposeIsIgnored() {
        ExecutorDebouncer debouncer = new ExecutorDebouncer(executor, 10);
        debouncer.dispose();

        debouncer.schedule(() -> fail("should not run"));

        assertFalse(debouncer.isPending());
    }

    @Test
    public void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutorDebouncer(executor, -1));
    }
}
