package com.questrail.instrument.runtime;

import com.questrail.instrument.api.OperatorHost;
import com.questrail.instrument.config.OperatorRuntimeConfig;
import com.questrail.instrument.gate.CompletionGate;
import com.questrail.instrument.internal.events.ErrorEvent;
import com.questrail.instrument.internal.events.ErrorKind;
import com.questrail.instrument.internal.events.OperatorEvent;
import com.questrail.instrument.internal.exec.ControllerDispatcher;
import com.questrail.instrument.internal.exec.OperatorWorker;
import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.SystemMonotonicClock;
import com.questrail.instrument.internal.time.SystemWallClock;
import com.questrail.instrument.internal.time.WallClock;
import com.questrail.instrument.observability.InstrumentErrorEvent;
import com.questrail.instrument.observability.InstrumentObservabilitySink;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.operator.OperatorFactory;
import com.questrail.instrument.operator.OperatorState;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OperatorRuntime
 * =============================================================================
 * Per-device owner of at most one live operator, its worker execution context
 * and the run-gate reference the activation holds.
 *
 * <h2>Activation cycle</h2>
 * <pre>
 *   activate(factory, args)
 *      ├─ RunGate.acquire()
 *      ├─ operator = factory.create(args)
 *      └─ worker.start()                          (returns immediately)
 *
 *   worker: prepare() returned  → Ready    ─┐
 *   worker: prepare() threw     → Failed   ─┤  posted to the controller
 *   worker: reportError(...)    → Failed   ─┘
 *
 *   controller: Ready   → preparedCompleted = true, host.operatorReady(result),
 *                         RunGate.release()
 *   controller: Failed  → host.showError / host.showException;
 *                         before readiness also RunGate.release(),
 *                         worker.requestStop() and host.terminate(),
 *                         without waiting for the worker
 *
 *   deactivate()
 *      ├─ worker.requestStop(), wait for exit      (timers cancelled, teardown)
 *      ├─ RunGate.release() if still held
 *      └─ teardown fault reported, never fatal
 *
 *   worker exit → teardown fault reported on the controller, unless
 *                 deactivate() already did
 * </pre>
 *
 * <h2>Run-gate accounting</h2>
 * <p>Each cycle takes exactly one run-gate reference and gives it back exactly
 * once, whichever of readiness, fatal error or deactivation comes first.</p>
 *
 * <h2>Stale events</h2>
 * <p>Events are stamped with the cycle that produced them. Anything arriving
 * for a cycle that has since been deactivated, or replaced, is dropped.</p>
 *
 * <h2>Threading</h2>
 * <p>{@link #activate}, {@link #deactivate} and {@link #submit} may be called
 * from any thread. Host callbacks run on the controller dispatch thread,
 * except that a teardown fault or a timeout found by {@code deactivate} is
 * reported on its caller's thread. Nothing on the dispatch thread waits for a
 * worker unless a host calls {@code deactivate} from there.</p>
 */
public final class OperatorRuntime<A, R> {

    private final String deviceName;
    private final OperatorHost<R> host;
    private final CompletionGate runGate;
    private final ControllerDispatcher dispatcher;
    private final OperatorRuntimeConfig config;
    private final InstrumentObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    private final Object lifecycleLock = new Object();
    private long cycleCounter;
    private volatile Cycle current;

    public OperatorRuntime(
            String deviceName,
            OperatorHost<R> host,
            CompletionGate runGate,
            ControllerDispatcher dispatcher,
            OperatorRuntimeConfig config,
            InstrumentObservabilitySink observabilitySink) {
        this(deviceName, host, runGate, dispatcher, config, observabilitySink,
                SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    public OperatorRuntime(
            String deviceName,
            OperatorHost<R> host,
            CompletionGate runGate,
            ControllerDispatcher dispatcher,
            OperatorRuntimeConfig config,
            InstrumentObservabilitySink observabilitySink,
            MonotonicClock clock,
            WallClock wallClock) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.host = Objects.requireNonNull(host, "host");
        this.runGate = Objects.requireNonNull(runGate, "runGate");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public String deviceName() {
        return deviceName;
    }

    /**
     * Starts a new activation cycle and returns without waiting for
     * {@code prepare}.
     *
     * @throws IllegalStateException if an earlier cycle has not been deactivated
     *                               or its worker has not exited yet
     * @throws RuntimeException      whatever the factory throws; the run-gate
     *                               reference is given back first
     */
    public void activate(OperatorFactory<A, R> factory, A args) {
        Objects.requireNonNull(factory, "factory");

        synchronized (lifecycleLock) {
            Cycle live = current;
            if (live != null && (!live.closed.get() || !live.worker.hasExited())) {
                throw new IllegalStateException("Device " + deviceName + " already has a live operator");
            }

            runGate.acquire();
            Operator<A, R> operator;
            try {
                operator = Objects.requireNonNull(factory.create(args), "factory returned null");
            } catch (RuntimeException e) {
                runGate.release();
                throw e;
            }

            long number = ++cycleCounter;
            Cycle cycle = new Cycle();
            cycle.worker = new OperatorWorker<>(
                    deviceName,
                    number,
                    config.workerThreadPrefix() + deviceName,
                    operator,
                    args,
                    dispatcher,
                    event -> handle(cycle, event),
                    () -> dispatcher.offer(() -> reap(cycle)),
                    clock,
                    wallClock,
                    observabilitySink);
            current = cycle;
            cycle.worker.start();
        }
    }

    /**
     * Stops the live operator, if any, and waits for its worker to exit.
     * A worker already told to stop by a fatal error is still waited for.
     * Calling it again once the worker is gone does nothing.
     */
    public void deactivate() {
        Cycle cycle;
        synchronized (lifecycleLock) {
            cycle = current;
            if (cycle == null) {
                return;
            }
            cycle.closed.set(true);
        }

        OperatorWorker<A, R> worker = cycle.worker;
        worker.requestStop();
        if (worker.awaitExit(config.deactivateTimeout())) {
            reap(cycle);
        }
        else if (cycle.timeoutReported.compareAndSet(false, true)) {
            surface(ErrorEvent.message(
                    ErrorKind.DEACTIVATE_TIMEOUT,
                    "Operator of device " + deviceName + " did not stop within "
                            + config.deactivateTimeout().orElseThrow(),
                    null,
                    wallClock.now()), false);
        }
        releaseGate(cycle);
    }

    /**
     * Runs {@code task} on the live operator's worker.
     *
     * @return {@code false} if no operator is live
     */
    public boolean submit(Runnable task) {
        Cycle cycle = current;
        if (cycle == null || cycle.closed.get()) {
            return false;
        }
        return cycle.worker.execute(task);
    }

    /**
     * Whether the current cycle's {@code prepare} has completed and been
     * delivered. {@code false} before the first activation.
     */
    public boolean preparedCompleted() {
        Cycle cycle = current;
        return cycle != null && cycle.preparedCompleted.get();
    }

    public OperatorState state() {
        Cycle cycle = current;
        return cycle == null ? OperatorState.CREATED : cycle.worker.state();
    }

    /** Number of the current activation cycle, 0 before the first activation. */
    public long cycle() {
        Cycle cycle = current;
        return cycle == null ? 0 : cycle.worker.cycle();
    }

    /** Whether an activation is live, that is activated and not yet deactivated. */
    public boolean isActive() {
        Cycle cycle = current;
        return cycle != null && !cycle.closed.get();
    }

    // -------------------------------------------------------------------------
    // Controller dispatch thread
    // -------------------------------------------------------------------------

    private void handle(Cycle cycle, OperatorEvent<R> event) {
        if (cycle != current || cycle.closed.get()) {
            return;
        }
        if (event instanceof OperatorEvent.Ready<R> ready) {
            onReady(cycle, ready.result());
        }
        else if (event instanceof OperatorEvent.Failed<R> failed) {
            onFailed(cycle, failed.error());
        }
    }

    private void onReady(Cycle cycle, R result) {
        if (!cycle.preparedCompleted.compareAndSet(false, true)) {
            return;
        }
        try {
            host.operatorReady(result);
        } finally {
            releaseGate(cycle);
        }
    }

    private void onFailed(Cycle cycle, ErrorEvent error) {
        boolean fatal = !cycle.preparedCompleted.get() && error.kind().canBeFatal();
        if (fatal && !cycle.closed.compareAndSet(false, true)) {
            return;
        }

        surface(error, fatal);

        if (fatal) {
            releaseGate(cycle);
            // Not waited for here; reap() collects the exit.
            cycle.worker.requestStop();
            host.terminate();
        }
    }

    // -------------------------------------------------------------------------
    // Shared
    // -------------------------------------------------------------------------

    /**
     * Reports the teardown fault of an exited worker, once. Reached from
     * {@link #deactivate()} and from the worker's exit callback.
     */
    private void reap(Cycle cycle) {
        synchronized (cycle) {
            if (cycle.reaped) {
                return;
            }
            cycle.reaped = true;
            cycle.worker.finalizeFault().ifPresent(fault -> surface(fault, false));
        }
    }

    private void surface(ErrorEvent error, boolean fatal) {
        observabilitySink.onError(InstrumentErrorEvent.of(deviceName, error, fatal));

        if (error instanceof ErrorEvent.Fault f) {
            host.showException(f.fault());
        }
        else if (error instanceof ErrorEvent.Message m) {
            host.showError(m.message(), m.detail());
        }
    }

    private void releaseGate(Cycle cycle) {
        if (cycle.gateHeld.compareAndSet(true, false)) {
            runGate.release();
        }
    }

    private final class Cycle {
        private final AtomicBoolean preparedCompleted = new AtomicBoolean(false);
        private final AtomicBoolean gateHeld = new AtomicBoolean(true);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicBoolean timeoutReported = new AtomicBoolean(false);
        private OperatorWorker<A, R> worker;
        private boolean reaped;
    }
}
