package com.questrail.instrument.api;

/**
 * Port onto the measurement-run state machine, which issues the lifecycle
 * notifications and is the only reader of the completion gates.
 */
public interface MeasurementLifecycle
{
    void connect(MeasurementListener listener);

    void disconnect(MeasurementListener listener);
}
