package com.questrail.instrument.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler implementation.
 *
 * Note: These tests use real time. Tolerances are set generously to avoid
 * false failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(50);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "Task should execute");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(
                Duration.ofMillis(100), SystemMonotonicClock.INSTANCE, () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(150);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void fixedRateRepeatsUntilCancelled() throws InterruptedException {
        AtomicInteger ticks = new AtomicInteger();
        CountDownLatch three = new CountDownLatch(3);

        Cancellable handle = scheduler.scheduleAtFixedRate(Duration.ofMillis(20), () -> {
            ticks.incrementAndGet();
            three.countDown();
        });

        assertTrue(three.await(1, TimeUnit.SECONDS));
        assertTrue(handle.cancel());

        // Let any tick already in flight finish
        Thread.sleep(50);
        int afterCancel = ticks.get();
        Thread.sleep(100);
        assertEquals(afterCancel, ticks.get(), "No ticks after cancel");
    }

    @Test
    void fixedRateRejectsNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAtFixedRate(Duration.ZERO, () -> {}));
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
