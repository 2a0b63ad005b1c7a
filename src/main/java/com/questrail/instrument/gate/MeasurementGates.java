package com.questrail.instrument.gate;

import java.util.Objects;

/**
 * The two gates of a control-engine session, created once at start-up and
 * handed by reference to every component that needs them.
 *
 * @param run  gate for outstanding run-level work
 * @param step gate for outstanding step-level work
 */
public record MeasurementGates(CompletionGate run, CompletionGate step) {

    public MeasurementGates {
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(step, "step");
        if (run.role() != GateRole.RUN) {
            throw new IllegalArgumentException("run gate must have role RUN");
        }
        if (step.role() != GateRole.STEP) {
            throw new IllegalArgumentException("step gate must have role STEP");
        }
    }

    public static MeasurementGates create() {
        return new MeasurementGates(new CompletionGate(GateRole.RUN), new CompletionGate(GateRole.STEP));
    }

    public CompletionGate forRole(GateRole role) {
        return role == GateRole.RUN ? run : step;
    }
}
