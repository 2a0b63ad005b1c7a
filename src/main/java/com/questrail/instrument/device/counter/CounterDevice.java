package com.questrail.instrument.device.counter;

import com.questrail.instrument.api.DataChannel;
import com.questrail.instrument.api.DeviceErrorSurface;
import com.questrail.instrument.api.MeasurementLifecycle;
import com.questrail.instrument.api.MeasurementListener;
import com.questrail.instrument.device.AbstractOperatorDevice;
import com.questrail.instrument.gate.CompletionGate;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.runtime.InstrumentRuntime;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CounterDevice
 * =============================================================================
 * Counting device publishing a continuous rate and a per-step total.
 *
 * <h2>Step gate</h2>
 * <p>When a step starts the device takes a StepGate reference, and it gives
 * the reference back only after the operator has published the step total on
 * its worker. The engine therefore cannot close the step before the total is
 * out. If the operator is gone by the time the step stops, the reference is
 * returned at once.</p>
 *
 * <p>Each step holds its own reference. A step may start while the previous
 * step's total is still pending on the worker; both references are then held
 * until their own step lets go.</p>
 *
 * <p>The device listens to the measurement lifecycle from the moment its
 * operator is ready until it is killed.</p>
 */
public class CounterDevice extends AbstractOperatorDevice<Duration, Void> implements MeasurementListener {

    private final MeasurementLifecycle lifecycle;
    private final CountSource source;
    private final DataChannel<Long> rate;
    private final DataChannel<Long> counts;
    private final CompletionGate stepGate;
    private final AtomicReference<StepReference> openStep = new AtomicReference<>();
    private final Set<StepReference> held = ConcurrentHashMap.newKeySet();

    private volatile CountingOperator operator;

    public CounterDevice(
            String name,
            InstrumentRuntime runtime,
            DeviceErrorSurface errorSurface,
            MeasurementLifecycle lifecycle,
            CountSource source,
            DataChannel<Long> rate,
            DataChannel<Long> counts) {
        super(name, runtime, errorSurface);
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.source = Objects.requireNonNull(source, "source");
        this.rate = Objects.requireNonNull(rate, "rate");
        this.counts = Objects.requireNonNull(counts, "counts");
        this.stepGate = runtime.gates().step();
    }

    @Override
    protected Operator<Duration, Void> createOperator(Duration interval) {
        CountingOperator op = new CountingOperator(source, rate, counts);
        operator = op;
        return op;
    }

    @Override
    public void operatorReady(Void result) {
        lifecycle.connect(this);
    }

    @Override
    public void started() {
        CountingOperator op = operator;
        if (op == null) {
            return;
        }
        StepReference step = new StepReference();
        if (!openStep.compareAndSet(null, step)) {
            // Already inside a step.
            step.release();
        }
        submitToOperator(op::measuringStarted);
    }

    @Override
    public void stopped() {
        StepReference step = openStep.getAndSet(null);
        if (step == null) {
            return;
        }
        CountingOperator op = operator;
        if (op == null) {
            step.release();
            return;
        }
        boolean queued = submitToOperator(() -> {
            try {
                op.measuringStopped();
            } finally {
                step.release();
            }
        });
        if (!queued) {
            step.release();
        }
    }

    /** Whether this device currently holds a StepGate reference. */
    public boolean holdsStepGate() {
        return !held.isEmpty();
    }

    /** Number of StepGate references this device holds. */
    int heldStepReferences() {
        return held.size();
    }

    @Override
    protected void onKilled() {
        lifecycle.disconnect(this);
        openStep.set(null);
        held.forEach(StepReference::release);
        rate.close();
        counts.close();
    }

    /** One StepGate reference, given back at most once. */
    private final class StepReference {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private StepReference() {
            stepGate.acquire();
            held.add(this);
        }

        void release() {
            if (released.compareAndSet(false, true)) {
                held.remove(this);
                stepGate.release();
            }
        }
    }
}
