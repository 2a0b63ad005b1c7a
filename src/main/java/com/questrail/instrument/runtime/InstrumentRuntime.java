package com.questrail.instrument.runtime;

import com.questrail.instrument.api.OperatorHost;
import com.questrail.instrument.config.OperatorRuntimeConfig;
import com.questrail.instrument.device.DeviceRegistry;
import com.questrail.instrument.gate.CompletionGate;
import com.questrail.instrument.gate.CompletionWaiter;
import com.questrail.instrument.gate.GateListener;
import com.questrail.instrument.gate.MeasurementGates;
import com.questrail.instrument.internal.exec.ControllerDispatcher;
import com.questrail.instrument.internal.time.Cancellable;
import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.MonotonicScheduler;
import com.questrail.instrument.internal.time.ScheduledExecutorScheduler;
import com.questrail.instrument.internal.time.SystemMonotonicClock;
import com.questrail.instrument.internal.time.SystemWallClock;
import com.questrail.instrument.internal.time.WallClock;
import com.questrail.instrument.observability.GateTransitionEvent;
import com.questrail.instrument.observability.InstrumentObservabilitySink;
import com.questrail.instrument.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * InstrumentRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one control-engine session.
 *
 * <h2>Owns</h2>
 * <ul>
 *   <li>the process-wide {@link MeasurementGates} (RunGate and StepGate)</li>
 *   <li>the {@link ControllerDispatcher} every operator reports through</li>
 *   <li>the {@link DeviceRegistry}</li>
 *   <li>a controller-side timer backing the {@link CompletionWaiter}</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 *   InstrumentRuntime runtime = InstrumentRuntime.builder()
 *       .withObservabilitySink(new Slf4jObservabilitySink())
 *       .build();
 *   runtime.start();
 *   ... create devices against runtime, activate them ...
 *   runtime.whenRunClear(() -> engine.finishRun());
 *   runtime.stop();
 * </pre>
 */
public final class InstrumentRuntime {

    private final MeasurementGates gates;
    private final ControllerDispatcher dispatcher;
    private final DeviceRegistry registry;
    private final OperatorRuntimeConfig config;
    private final InstrumentObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ScheduledExecutorService timerExecutor;
    private final CompletionWaiter waiter;

    private InstrumentRuntime(
            MeasurementGates gates,
            ControllerDispatcher dispatcher,
            OperatorRuntimeConfig config,
            InstrumentObservabilitySink observabilitySink,
            MonotonicClock clock,
            WallClock wallClock,
            ScheduledExecutorService timerExecutor,
            CompletionWaiter waiter) {
        this.gates = gates;
        this.dispatcher = dispatcher;
        this.registry = new DeviceRegistry();
        this.config = config;
        this.observabilitySink = observabilitySink;
        this.clock = clock;
        this.wallClock = wallClock;
        this.timerExecutor = timerExecutor;
        this.waiter = waiter;
    }

    public void start() {
        dispatcher.start();
    }

    /**
     * Kills every registered device, then stops the dispatcher and the timer.
     */
    public void stop() {
        try {
            registry.killAll();
        } finally {
            dispatcher.stop();
            timerExecutor.shutdown();
            try {
                if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    timerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                timerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Creates the runtime through which the device named {@code deviceName}
     * runs its operators. Its activations hold this session's RunGate.
     */
    public <A, R> OperatorRuntime<A, R> newOperatorRuntime(String deviceName, OperatorHost<R> host) {
        return new OperatorRuntime<>(
                deviceName, host, gates.run(), dispatcher, config, observabilitySink, clock, wallClock);
    }

    /**
     * Runs {@code action} on the controller dispatch thread once the RunGate
     * is observed at zero.
     */
    public Cancellable whenRunClear(Runnable action) {
        return whenClear(gates.run(), action);
    }

    /**
     * Runs {@code action} on the controller dispatch thread once the StepGate
     * is observed at zero.
     */
    public Cancellable whenStepClear(Runnable action) {
        return whenClear(gates.step(), action);
    }

    private Cancellable whenClear(CompletionGate gate, Runnable action) {
        Objects.requireNonNull(action, "action");
        return waiter.whenClear(gate, () -> dispatcher.post(action));
    }

    public MeasurementGates gates() {
        return gates;
    }

    public DeviceRegistry registry() {
        return registry;
    }

    public OperatorRuntimeConfig config() {
        return config;
    }

    public InstrumentObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    public ControllerDispatcher dispatcher() {
        return dispatcher;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MeasurementGates gates;
        private OperatorRuntimeConfig config = OperatorRuntimeConfig.defaults();
        private InstrumentObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Duration completionPollInterval = CompletionWaiter.DEFAULT_POLL_INTERVAL;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        /**
         * Shares existing gates instead of creating a fresh pair.
         */
        public Builder withGates(MeasurementGates gates) {
            this.gates = gates;
            return this;
        }

        public Builder withConfig(OperatorRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(InstrumentObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withCompletionPollInterval(Duration interval) {
            this.completionPollInterval = interval;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public InstrumentRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(completionPollInterval, "completionPollInterval");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            // 1. Gates, with transitions mirrored to the sink
            MeasurementGates effectiveGates = gates != null ? gates : MeasurementGates.create();
            GateListener gateObserver = new GateListener() {
                @Override
                public void gateAcquired(CompletionGate gate) {
                    observabilitySink.onGateTransition(new GateTransitionEvent(
                            wallClock.now(), gate.role(), GateTransitionEvent.Edge.ACQUIRED));
                }

                @Override
                public void gateReleased(CompletionGate gate) {
                    observabilitySink.onGateTransition(new GateTransitionEvent(
                            wallClock.now(), gate.role(), GateTransitionEvent.Edge.RELEASED));
                }
            };
            effectiveGates.run().addListener(gateObserver);
            effectiveGates.step().addListener(gateObserver);

            // 2. Controller dispatch loop
            ControllerDispatcher dispatcher = new ControllerDispatcher(
                    config.dispatchQueueCapacity(), observabilitySink);

            // 3. Controller-side timer for completion polling
            ScheduledExecutorService timerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "instrument-completion-timer");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler timer = new ScheduledExecutorScheduler(timerExec, clock);
            CompletionWaiter waiter = new CompletionWaiter(timer, clock, completionPollInterval);

            return new InstrumentRuntime(
                    effectiveGates, dispatcher, config, observabilitySink, clock, wallClock, timerExec, waiter);
        }
    }
}
