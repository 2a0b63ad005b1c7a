package com.questrail.instrument.observability;

import com.questrail.instrument.gate.GateRole;

import java.time.Instant;

/**
 * A completion gate crossed zero in either direction.
 */
public record GateTransitionEvent(
    Instant timestamp,
    GateRole role,
    Edge edge
) {
    public enum Edge {
        /** 0 -> 1 */
        ACQUIRED,
        /** 1 -> 0 */
        RELEASED
    }
}
