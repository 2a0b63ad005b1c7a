package com.questrail.instrument.observability;

/**
 * Receives runtime observability events. Implementations can provide
 * logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from worker threads, the controller dispatch thread and
 * whichever thread touched a gate; implementations must be thread-safe.</p>
 */
public interface InstrumentObservabilitySink {
    /**
     * Called when an operator changes lifecycle state.
     * @param event the transition details
     */
    void onOperatorTransition(OperatorTransitionEvent event);

    /**
     * Called when a completion gate crosses zero.
     * @param event the edge
     */
    void onGateTransition(GateTransitionEvent event);

    /**
     * Called for every error reported to a device or caught by the runtime.
     * @param event the error
     */
    void onError(InstrumentErrorEvent event);
}
