package com.questrail.instrument.api;

/**
 * OperatorHost
 * -----------------------------------------------------------------------------
 * Capability a device implements to own an
 * {@link com.questrail.instrument.runtime.OperatorRuntime}.
 *
 * <p>Callbacks are invoked on the controller dispatch thread, never on the
 * operator's worker. The one exception: an error found while a caller waits in
 * {@code deactivate} is shown on that caller's thread.</p>
 *
 * @param <R> result type of the operator's {@code prepare}
 */
public interface OperatorHost<R> extends DeviceErrorSurface
{
    /**
     * The operator finished {@code prepare}; the device is now usable.
     * Called at most once per activation.
     *
     * @param result value returned by {@code prepare}; may be {@code null}
     */
    void operatorReady(R result);

    /**
     * The activation failed before becoming ready. The device must tear itself
     * down; it never reaches a usable state in this cycle. The operator has
     * already been told to stop. Implementations must not block here waiting
     * for it.
     */
    void terminate();
}
