package com.questrail.instrument.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of InstrumentObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements InstrumentObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onOperatorTransition(OperatorTransitionEvent event) {
        log.info("Device {} operator (cycle {}): {} -> {}",
            event.deviceName(),
            event.cycle(),
            event.from(),
            event.to());
    }

    @Override
    public void onGateTransition(GateTransitionEvent event) {
        log.debug("{} gate {}", event.role(), event.edge());
    }

    @Override
    public void onError(InstrumentErrorEvent event) {
        if (event.fatal()) {
            log.error("Device {} failed [{}]: {}", event.source(), event.kind(), event.message(), event.cause());
        }
        else {
            log.error("Device {} reported [{}]: {}", event.source(), event.kind(), event.message(), event.cause());
        }
    }
}
