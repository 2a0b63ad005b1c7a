package com.questrail.instrument.observability;

import com.questrail.instrument.operator.OperatorState;

import java.time.Instant;

/**
 * An operator moved between lifecycle states.
 *
 * @param deviceName owning device
 * @param cycle      activation cycle of the owning runtime
 */
public record OperatorTransitionEvent(
    Instant timestamp,
    String deviceName,
    long cycle,
    OperatorState from,
    OperatorState to
) {
}
