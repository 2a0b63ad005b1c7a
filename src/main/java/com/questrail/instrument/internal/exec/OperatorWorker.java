package com.questrail.instrument.internal.exec;

import com.questrail.instrument.internal.events.ErrorEvent;
import com.questrail.instrument.internal.events.ErrorKind;
import com.questrail.instrument.internal.events.OperatorEvent;
import com.questrail.instrument.internal.time.Cancellable;
import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.MonotonicScheduler;
import com.questrail.instrument.internal.time.ScheduledExecutorScheduler;
import com.questrail.instrument.internal.time.WallClock;
import com.questrail.instrument.observability.InstrumentObservabilitySink;
import com.questrail.instrument.observability.OperatorTransitionEvent;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.operator.OperatorContext;
import com.questrail.instrument.operator.OperatorState;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * OperatorWorker
 * =============================================================================
 * Dedicated worker execution context hosting one operator for one activation
 * cycle.
 *
 * <h2>Threading</h2>
 * <p>The worker owns a single-threaded scheduled executor. {@code prepare},
 * every operator timer callback, every task submitted through
 * {@link #execute(Runnable)} and {@code teardown} run on that thread, strictly
 * one after another.</p>
 *
 * <h2>Outbound events</h2>
 * <p>Readiness and error events are posted to the {@link ControllerDispatcher}
 * and handed to the owning runtime there. Posting gives up once a stop has
 * been requested, so a controller blocked in deactivation never waits on a
 * worker that is itself waiting for room in the channel.</p>
 *
 * <h2>Stop</h2>
 * <p>{@link #requestStop()} queues a final task that cancels every timer the
 * operator scheduled, runs {@code teardown} unless {@code prepare} failed, and
 * lets the executor terminate. A teardown fault is kept and exposed through
 * {@link #finalizeFault()} rather than posted. The exit callback runs on the
 * worker thread once the executor has terminated.</p>
 *
 * <h2>Faults</h2>
 * <p>Anything thrown by {@code prepare}, {@code teardown}, a timer or a
 * submitted task is caught at the worker boundary, errors included, and
 * turned into an {@link ErrorEvent}.</p>
 */
public final class OperatorWorker<A, R> implements OperatorContext {

    private final String deviceName;
    private final long cycle;
    private final Operator<A, R> operator;
    private final A args;
    private final ControllerDispatcher dispatcher;
    private final Consumer<OperatorEvent<R>> eventHandler;
    private final Runnable onExit;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final InstrumentObservabilitySink observabilitySink;

    private final ScheduledThreadPoolExecutor executor;
    private final TrackingScheduler scheduler;

    private final AtomicReference<OperatorState> state = new AtomicReference<>(OperatorState.CREATED);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private volatile ErrorEvent finalizeFault;

    /**
     * @param eventHandler invoked on the dispatch thread for every event this
     *                     worker posts
     * @param onExit       invoked on the worker thread after the executor has
     *                     terminated; must not block
     */
    public OperatorWorker(
            String deviceName,
            long cycle,
            String threadName,
            Operator<A, R> operator,
            A args,
            ControllerDispatcher dispatcher,
            Consumer<OperatorEvent<R>> eventHandler,
            Runnable onExit,
            MonotonicClock clock,
            WallClock wallClock,
            InstrumentObservabilitySink observabilitySink) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.cycle = cycle;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.args = args;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.eventHandler = Objects.requireNonNull(eventHandler, "eventHandler");
        this.onExit = Objects.requireNonNull(onExit, "onExit");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        Objects.requireNonNull(threadName, "threadName");
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        }) {
            @Override
            protected void terminated() {
                try {
                    OperatorWorker.this.onExit.run();
                } finally {
                    super.terminated();
                }
            }
        };
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);

        this.scheduler = new TrackingScheduler(new ScheduledExecutorScheduler(executor, clock));
    }

    /**
     * Starts the worker and queues {@code prepare}. Returns immediately.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Worker for " + deviceName + " already started");
        }
        transition(OperatorState.CREATED, OperatorState.STARTING);
        executor.execute(this::runPrepare);
    }

    public long cycle() {
        return cycle;
    }

    public OperatorState state() {
        return state.get();
    }

    public boolean stopRequested() {
        return stopRequested.get();
    }

    /**
     * Runs {@code task} on the worker thread. A task that throws is reported
     * as a structured error.
     *
     * @return {@code false} if the worker is stopping or gone
     */
    public boolean execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (stopRequested.get()) {
            return false;
        }
        try {
            executor.execute(guarded(task));
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    /**
     * Requests the worker to stop. Safe to call more than once and from any
     * thread; only the first call has an effect.
     */
    public void requestStop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        if (!started.get()) {
            executor.shutdownNow();
            return;
        }
        executor.execute(this::runTeardown);
        executor.shutdown();
    }

    /**
     * Waits for the worker thread to finish. Interrupts do not cut the wait
     * short; the caller's interrupt status is restored before returning.
     *
     * @param timeout upper bound, or empty to wait as long as it takes
     * @return {@code true} if the worker has exited, {@code false} only if
     *         the bound expired first
     */
    public boolean awaitExit(Optional<Duration> timeout) {
        long deadline = timeout.map(t -> System.nanoTime() + t.toNanos()).orElse(0L);
        boolean interrupted = false;
        try {
            while (!executor.isTerminated()) {
                long waitNanos = TimeUnit.MINUTES.toNanos(1);
                if (timeout.isPresent()) {
                    waitNanos = deadline - System.nanoTime();
                    if (waitNanos <= 0) {
                        return false;
                    }
                }
                try {
                    executor.awaitTermination(waitNanos, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            return true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Whether the worker thread has finished and the exit callback has run. */
    public boolean hasExited() {
        return executor.isTerminated();
    }

    /**
     * The fault {@code teardown} threw, if any. Meaningful once the worker has
     * exited.
     */
    public Optional<ErrorEvent> finalizeFault() {
        return Optional.ofNullable(finalizeFault);
    }

    // -------------------------------------------------------------------------
    // OperatorContext
    // -------------------------------------------------------------------------

    @Override
    public String deviceName() {
        return deviceName;
    }

    @Override
    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    @Override
    public MonotonicClock clock() {
        return clock;
    }

    @Override
    public void reportError(String message, Object detail) {
        post(new OperatorEvent.Failed<>(cycle,
                ErrorEvent.message(ErrorKind.STRUCTURED, message, detail, wallClock.now())));
    }

    @Override
    public void reportException(Throwable fault) {
        post(new OperatorEvent.Failed<>(cycle,
                ErrorEvent.fault(ErrorKind.STRUCTURED, fault, wallClock.now())));
    }

    // -------------------------------------------------------------------------
    // Worker thread
    // -------------------------------------------------------------------------

    private void runPrepare() {
        if (stopRequested.get()) {
            // Stopped before prepare got a chance to run; teardown has
            // nothing to release.
            transition(OperatorState.STARTING, OperatorState.FAILED);
            return;
        }

        R result;
        try {
            result = operator.prepare(this, args);
        } catch (Throwable e) {
            transition(OperatorState.STARTING, OperatorState.FAILED);
            scheduler.cancelAll();
            post(new OperatorEvent.Failed<>(cycle,
                    ErrorEvent.fault(ErrorKind.PREPARE_FAULT, e, wallClock.now())));
            return;
        }

        transition(OperatorState.STARTING, OperatorState.READY);
        transition(OperatorState.READY, OperatorState.ACTIVE);
        post(new OperatorEvent.Ready<>(cycle, result));
    }

    private void runTeardown() {
        scheduler.cancelAll();

        OperatorState current = state.get();
        if (current == OperatorState.FAILED) {
            return;
        }

        transition(current, OperatorState.STOPPING);
        try {
            operator.teardown();
        } catch (Throwable e) {
            finalizeFault = ErrorEvent.fault(ErrorKind.FINALIZE_FAULT, e, wallClock.now());
        }
        transition(OperatorState.STOPPING, OperatorState.FINALIZED);
    }

    private void post(OperatorEvent<R> event) {
        dispatcher.post(() -> eventHandler.accept(event), stopRequested::get);
    }

    private void transition(OperatorState from, OperatorState to) {
        if (state.compareAndSet(from, to)) {
            observabilitySink.onOperatorTransition(
                    new OperatorTransitionEvent(wallClock.now(), deviceName, cycle, from, to));
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable e) {
                reportException(e);
            }
        };
    }

    /**
     * Operator-facing scheduler. Keeps every live handle so the worker can
     * cancel outstanding timers before teardown, and reports timer tasks that
     * throw instead of letting the executor swallow them.
     */
    private final class TrackingScheduler implements MonotonicScheduler {
        private final MonotonicScheduler delegate;
        private final Set<TrackedTask> live = ConcurrentHashMap.newKeySet();

        private TrackingScheduler(MonotonicScheduler delegate) {
            this.delegate = delegate;
        }

        @Override
        public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
            TrackedTask tracked = new TrackedTask(task, false);
            live.add(tracked);
            try {
                tracked.handle = delegate.scheduleAtNanos(deadlineNanos, tracked);
            } catch (RejectedExecutionException e) {
                // Worker is shutting down; the task would never run.
                tracked.cancel();
            }
            return tracked;
        }

        @Override
        public Cancellable scheduleAtFixedRate(Duration period, Runnable task) {
            TrackedTask tracked = new TrackedTask(task, true);
            live.add(tracked);
            try {
                tracked.handle = delegate.scheduleAtFixedRate(period, tracked);
            } catch (RejectedExecutionException e) {
                tracked.cancel();
            }
            return tracked;
        }

        void cancelAll() {
            for (TrackedTask t : live) {
                t.cancel();
            }
            live.clear();
        }

        private final class TrackedTask implements Runnable, Cancellable {
            private final Runnable task;
            private final boolean periodic;
            private volatile Cancellable handle;
            private volatile boolean cancelled;

            private TrackedTask(Runnable task, boolean periodic) {
                this.task = Objects.requireNonNull(task, "task");
                this.periodic = periodic;
            }

            @Override
            public void run() {
                if (cancelled) {
                    return;
                }
                if (!periodic) {
                    live.remove(this);
                }
                guarded(task).run();
            }

            @Override
            public boolean cancel() {
                if (cancelled) {
                    return false;
                }
                cancelled = true;
                live.remove(this);
                Cancellable h = handle;
                return h == null || h.cancel();
            }
        }
    }
}
