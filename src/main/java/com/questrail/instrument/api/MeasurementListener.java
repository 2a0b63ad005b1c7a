package com.questrail.instrument.api;

/**
 * Callbacks a device registers with the run/step controller.
 *
 * <p>All methods run on the controller context.</p>
 */
public interface MeasurementListener
{
    /** The run has been set up and is about to begin its first step. */
    default void prepared() {}

    /** A step started acquiring data. */
    default void started() {}

    /** A step stopped acquiring data. Data may still be in flight. */
    default void stopped() {}
}
