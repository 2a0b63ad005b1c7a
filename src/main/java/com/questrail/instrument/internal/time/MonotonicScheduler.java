package com.questrail.instrument.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred and recurring execution expressed in monotonic time.
 *
 * <p>An operator's scheduler runs every task on that operator's worker
 * execution context, so timer callbacks may touch operator state without
 * further synchronization. The controller-side scheduler used by
 * {@link com.questrail.instrument.gate.CompletionWaiter} runs tasks on its own
 * thread instead.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run once at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline from {@link MonotonicClock#nowNanos()}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task to run repeatedly, first after {@code period} and then at
     * a fixed rate of one run per {@code period} until cancelled.
     *
     * @param period interval between runs, must be positive
     * @param task   task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtFixedRate(Duration period, Runnable task);

    /**
     * Schedule a task to run once after {@code delay}, measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
