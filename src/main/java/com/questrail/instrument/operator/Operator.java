package com.questrail.instrument.operator;

/**
 * Operator
 * =============================================================================
 * Unit of background work owned by one device and run entirely on one worker
 * execution context.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #prepare} runs once, immediately after the worker starts. It
 *       may block for as long as the hardware needs.</li>
 *   <li>{@link #teardown()} runs once, when the owning runtime asks the worker
 *       to stop. It is not called if {@code prepare} threw.</li>
 * </ul>
 *
 * <h2>Faults</h2>
 * <p>Anything thrown from either method is caught at the worker boundary and
 * delivered to the device as an error. A throwing {@code prepare} ends the
 * activation; a throwing {@code teardown} is reported and the worker still
 * exits.</p>
 *
 * <h2>Threading</h2>
 * <p>Both methods, and every task scheduled through
 * {@link OperatorContext#scheduler()}, run on the same worker thread, so an
 * operator's fields need no locking as long as nothing else touches them.</p>
 *
 * @param <A> construction/preparation arguments
 * @param <R> result handed to the device when the operator is ready
 */
public interface Operator<A, R>
{
    /**
     * Bring the operator up: connect, configure, start timers.
     *
     * @param context the hosting worker
     * @param args    immutable arguments the device activated with
     * @return value passed to the device's {@code operatorReady}; may be {@code null}
     * @throws Exception any failure; fatal to the activation
     */
    R prepare(OperatorContext context, A args) throws Exception;

    /**
     * Release whatever {@link #prepare} acquired. Timers scheduled on the
     * worker have already been cancelled.
     *
     * @throws Exception reported to the device, never fatal
     */
    default void teardown() throws Exception {}
}
