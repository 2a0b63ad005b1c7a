package com.questrail.instrument.internal.time;

/**
 * Cancellation handle for a one-shot or recurring task handed to a
 * {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Stops the task from running again.
     *
     * @return {@code true} if this call cancelled it; {@code false} if a
     *         one-shot task already ran or the task was cancelled before.
     */
    boolean cancel();
}
