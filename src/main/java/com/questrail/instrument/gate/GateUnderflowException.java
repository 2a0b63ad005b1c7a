package com.questrail.instrument.gate;

/**
 * Thrown when a {@link CompletionGate} is released more often than it was
 * acquired. This is a defect in the releasing component, not a condition to
 * recover from.
 */
public final class GateUnderflowException extends IllegalStateException {

    private final GateRole role;

    public GateUnderflowException(GateRole role) {
        super(role + " gate released while its count was already zero");
        this.role = role;
    }

    public GateRole role() {
        return role;
    }
}
