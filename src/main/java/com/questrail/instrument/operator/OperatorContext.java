package com.questrail.instrument.operator;

import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.MonotonicScheduler;

/**
 * OperatorContext
 * -----------------------------------------------------------------------------
 * What the hosting worker execution context offers its operator.
 *
 * <p>The context is handed to {@link Operator#prepare} and stays valid until
 * the worker exits. Operators usually keep it in a field.</p>
 */
public interface OperatorContext
{
    /** Name of the owning device. */
    String deviceName();

    /**
     * Scheduler whose tasks run on this worker. Anything scheduled here is
     * cancelled before {@link Operator#teardown()} runs.
     */
    MonotonicScheduler scheduler();

    MonotonicClock clock();

    /**
     * Raise a domain error on the owning device. Always produces an error
     * event, whether or not {@code prepare} has completed; it is fatal only
     * while the operator is not yet ready.
     *
     * @param message human-readable description
     * @param detail  optional context; may be {@code null}
     */
    void reportError(String message, Object detail);

    /**
     * Raise a fault on the owning device, with the same fatality rule as
     * {@link #reportError}.
     */
    void reportException(Throwable fault);
}
