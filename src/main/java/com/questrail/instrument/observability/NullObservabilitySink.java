package com.questrail.instrument.observability;

/**
 * No-op implementation of InstrumentObservabilitySink.
 */
public final class NullObservabilitySink implements InstrumentObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onOperatorTransition(OperatorTransitionEvent event) {}

    @Override
    public void onGateTransition(GateTransitionEvent event) {}

    @Override
    public void onError(InstrumentErrorEvent event) {}
}
