package com.questrail.instrument.gate;

/**
 * Receives edge notifications from a {@link CompletionGate}.
 *
 * <p>Callbacks run on whichever thread performed the transition, after the
 * counter update. The count may already have moved again by the time a
 * callback runs; listeners that care re-read {@link CompletionGate#count()}.</p>
 */
public interface GateListener
{
    /** The count went from zero to one. */
    default void gateAcquired(CompletionGate gate) {}

    /** The count went from one to zero. */
    default void gateReleased(CompletionGate gate) {}
}
