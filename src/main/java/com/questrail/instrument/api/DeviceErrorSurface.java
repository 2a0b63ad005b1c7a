package com.questrail.instrument.api;

/**
 * DeviceErrorSurface
 * -----------------------------------------------------------------------------
 * Where a device reports errors upward to its own UI or logging collaborator.
 *
 * <p>Every fault raised on behalf of a device ends up here exactly once; the
 * runtime never drops an error silently.</p>
 */
public interface DeviceErrorSurface
{
    /**
     * Report an error.
     *
     * @param message human-readable description
     * @param detail  optional extra context, typically a string or a
     *                {@link Throwable}; may be {@code null}
     */
    void showError(String message, Object detail);

    /**
     * Report a fault. Shortcut for {@code showError(fault.getMessage(), fault)}.
     */
    default void showException(Throwable fault) {
        String message = fault.getMessage();
        showError(message != null ? message : fault.getClass().getName(), fault);
    }
}
