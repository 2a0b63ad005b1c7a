package com.questrail.instrument.operator;

/**
 * Lifecycle of an operator on its worker execution context.
 *
 * <pre>
 * CREATED
 *    │ worker started
 *    ▼
 * STARTING ──(prepare threw, or stopped before it ran)──► FAILED
 *    │ prepare returned
 *    ▼
 * READY
 *    │ steady state; the ready event is posted from here
 *    ▼
 * ACTIVE
 *    │ owning runtime requested stop
 *    ▼
 * STOPPING
 *    │ teardown returned or threw
 *    ▼
 * FINALIZED
 * </pre>
 *
 * <p>Transitions only move forward. {@code FAILED} and {@code FINALIZED} are
 * terminal.</p>
 */
public enum OperatorState {
    CREATED,
    STARTING,
    READY,
    ACTIVE,
    STOPPING,
    FINALIZED,
    FAILED;

    public boolean isTerminal() {
        return this == FINALIZED || this == FAILED;
    }
}
