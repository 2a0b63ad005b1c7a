package com.questrail.instrument.internal.events;

/**
 * ErrorKind
 * -----------------------------------------------------------------------------
 * Origin of an {@link ErrorEvent}. The kind, together with whether the owning
 * runtime has already seen its ready event, decides whether an error is fatal.
 */
public enum ErrorKind {

    /** Exception thrown by {@code Operator.prepare}. Always fatal to the activation. */
    PREPARE_FAULT,

    /** Exception thrown by {@code Operator.teardown}. Reported, never fatal. */
    FINALIZE_FAULT,

    /**
     * Error raised explicitly by operator or device code outside the
     * prepare/teardown checkpoints. Fatal only before the operator is ready.
     */
    STRUCTURED,

    /** A gate release without a matching acquire. A caller defect. */
    GATE_UNDERFLOW,

    /** The bounded wait for a worker to exit expired. */
    DEACTIVATE_TIMEOUT,

    /** A device callback threw while running on the controller dispatch thread. */
    HANDLER_FAULT;

    /**
     * Returns whether errors of this kind can end an activation that has not
     * yet become ready.
     */
    public boolean canBeFatal() {
        return this == PREPARE_FAULT || this == STRUCTURED;
    }
}
