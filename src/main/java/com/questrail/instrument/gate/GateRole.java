package com.questrail.instrument.gate;

/**
 * Which measurement unit a {@link CompletionGate} holds open.
 */
public enum GateRole {

    /**
     * Outstanding work for a whole measurement run, typically device
     * initialization that must settle before a run may start or finish.
     */
    RUN,

    /**
     * Outstanding work for a single step, typically data that must be flushed
     * before the step may be closed.
     */
    STEP
}
