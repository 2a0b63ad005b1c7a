package com.questrail.instrument.runtime;

import com.questrail.instrument.config.OperatorRuntimeConfig;
import com.questrail.instrument.gate.CompletionGate;
import com.questrail.instrument.gate.MeasurementGates;
import com.questrail.instrument.internal.events.ErrorKind;
import com.questrail.instrument.internal.exec.ControllerDispatcher;
import com.questrail.instrument.observability.InstrumentErrorEvent;
import com.questrail.instrument.observability.OperatorTransitionEvent;
import com.questrail.instrument.observability.RecordingObservabilitySink;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.operator.OperatorContext;
import com.questrail.instrument.operator.OperatorState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperatorRuntimeTest
 * -----------------------------------------------------------------------------
 * Activation cycles end to end: worker, controller dispatch loop and RunGate.
 *
 * Note: these tests use real threads. Waits are bounded by latches with
 * generous timeouts.
 */
class OperatorRuntimeTest {

    private RecordingObservabilitySink sink;
    private ControllerDispatcher dispatcher;
    private MeasurementGates gates;
    private CompletionGate runGate;
    private OperatorRuntimeConfig config;
    private final List<OperatorRuntime<?, ?>> runtimes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        dispatcher = new ControllerDispatcher(64, sink);
        dispatcher.start();
        gates = MeasurementGates.create();
        runGate = gates.run();
        config = OperatorRuntimeConfig.defaults();
    }

    @AfterEach
    void tearDown() {
        runtimes.forEach(OperatorRuntime::deactivate);
        dispatcher.stop();
    }

    // -------------------------------------------------------------------------
    // Scenarios
    // -------------------------------------------------------------------------

    @Test
    void successfulActivationDeliversReadyOnceAndReleasesGate() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("X", host);
        ScriptedOperator op = new ScriptedOperator().blockPrepare();

        runtime.activate(args -> op, "x");

        assertEquals(1, runGate.count(), "Activation holds the gate until ready");
        assertFalse(runtime.preparedCompleted());

        op.proceed.countDown();
        assertTrue(host.awaitReady());
        awaitDispatcherIdle();

        assertEquals(0, runGate.count());
        assertEquals(List.of("x-ready"), host.readyResults());
        assertTrue(host.errors().isEmpty());
        assertTrue(runtime.preparedCompleted());
        assertEquals(OperatorState.ACTIVE, runtime.state());
        assertEquals(List.of("instrument-controller"), host.callbackThreads());
    }

    @Test
    void failedPrepareKillsOnlyThatDevice() throws InterruptedException {
        RecordingHost<String> hostX = new RecordingHost<>();
        RecordingHost<String> hostY = new RecordingHost<>();
        OperatorRuntime<String, String> x = runtime("X", hostX);
        OperatorRuntime<String, String> y = runtime("Y", hostY);

        ScriptedOperator opX = new ScriptedOperator().blockPrepare().failPrepare(new IllegalStateException("no port"));
        ScriptedOperator opY = new ScriptedOperator().blockPrepare();

        x.activate(args -> opX, "x");
        assertEquals(1, runGate.count());
        y.activate(args -> opY, "y");
        assertEquals(2, runGate.count());

        opX.proceed.countDown();
        assertTrue(hostX.awaitTerminate());
        awaitDispatcherIdle();
        assertEquals(1, runGate.count());

        opY.proceed.countDown();
        assertTrue(hostY.awaitReady());
        awaitDispatcherIdle();
        assertEquals(0, runGate.count());

        assertTrue(hostX.readyResults().isEmpty());
        assertEquals(1, hostX.errors().size());
        assertEquals("no port", hostX.errors().get(0).fault().getMessage());
        assertEquals(1, hostX.terminations());
        assertEquals(OperatorState.FAILED, x.state());
        assertFalse(x.isActive());

        assertEquals(List.of("y-ready"), hostY.readyResults());
        assertTrue(hostY.errors().isEmpty());
        assertEquals(0, hostY.terminations());
    }

    @Test
    void prepareFaultIsFatalAndSkipsTeardown() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator().failPrepare(new RuntimeException("handshake"));

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitTerminate());
        awaitDispatcherIdle();

        assertEquals(0, op.teardowns.get());
        assertEquals(0, runGate.count());

        List<InstrumentErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals(ErrorKind.PREPARE_FAULT, errors.get(0).kind());
        assertTrue(errors.get(0).fatal());
        assertEquals("dev", errors.get(0).source());

        // Deactivating the dead runtime is a no-op
        runtime.deactivate();
        assertEquals(0, runGate.count());
        assertEquals(1, host.terminations());
    }

    @Test
    void deactivateIsIdempotent() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator();

        runtime.deactivate();

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitReady());
        awaitDispatcherIdle();

        runtime.deactivate();
        runtime.deactivate();

        assertEquals(0, runGate.count());
        assertEquals(1, op.teardowns.get());
        assertEquals(OperatorState.FINALIZED, runtime.state());
        assertTrue(runtime.preparedCompleted(), "Never reverts within the cycle");
        assertTrue(host.errors().isEmpty());
    }

    @Test
    void deactivateDuringPrepareReleasesGateAndDropsLateReady() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator().blockPrepare();

        runtime.activate(args -> op, "a");
        assertTrue(op.prepareEntered.await(1, TimeUnit.SECONDS));

        Thread deactivator = new Thread(runtime::deactivate);
        deactivator.start();

        // No mid-prepare cancellation: deactivate waits for prepare to finish
        deactivator.join(100);
        assertTrue(deactivator.isAlive());

        op.proceed.countDown();
        deactivator.join(2000);
        assertFalse(deactivator.isAlive());
        awaitDispatcherIdle();

        assertEquals(0, runGate.count());
        assertTrue(host.readyResults().isEmpty());
        assertEquals(1, op.teardowns.get(), "A completed prepare is torn down");
    }

    // -------------------------------------------------------------------------
    // Errors
    // -------------------------------------------------------------------------

    @Test
    void finalizeFaultIsReportedButNotFatal() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator().failTeardown(new IllegalStateException("port stuck"));

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitReady());

        runtime.deactivate();

        assertEquals(1, host.errors().size());
        assertEquals("port stuck", host.errors().get(0).fault().getMessage());
        assertEquals(0, host.terminations());
        assertEquals(OperatorState.FINALIZED, runtime.state());
        assertEquals(0, runGate.count());

        InstrumentErrorEvent error = sink.getErrors().get(0);
        assertEquals(ErrorKind.FINALIZE_FAULT, error.kind());
        assertFalse(error.fatal());
    }

    @Test
    void structuredErrorBeforeReadyIsFatal() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator()
                .onPrepare(ctx -> ctx.reportError("bad configuration", "rate=0"));

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitTerminate());
        awaitDispatcherIdle();

        assertTrue(host.readyResults().isEmpty(), "Ready never follows a fatal error");
        assertEquals(1, host.errors().size());
        assertEquals("bad configuration", host.errors().get(0).message());
        assertEquals("rate=0", host.errors().get(0).detail());
        assertEquals(1, host.terminations());
        assertEquals(0, runGate.count());

        // The worker winds down on its own; deactivate waits for it
        runtime.deactivate();
        assertEquals(1, op.teardowns.get());
        assertEquals(OperatorState.FINALIZED, runtime.state());
    }

    @Test
    void structuredErrorAfterReadyIsInformational() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator();

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitReady());

        assertTrue(runtime.submit(() -> op.context.reportError("drift", 42)));
        assertTrue(host.awaitError());
        awaitDispatcherIdle();

        assertEquals(0, host.terminations());
        assertTrue(runtime.isActive());
        assertEquals(0, runGate.count());
        assertEquals(42, host.errors().get(0).detail());

        InstrumentErrorEvent error = sink.getErrors().get(0);
        assertEquals(ErrorKind.STRUCTURED, error.kind());
        assertFalse(error.fatal());
    }

    @Test
    void throwingTimerIsReportedAndKeepsRunning() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        AtomicInteger ticks = new AtomicInteger();
        ScriptedOperator op = new ScriptedOperator().onPrepare(ctx ->
                ctx.scheduler().scheduleAtFixedRate(Duration.ofMillis(10), () -> {
                    ticks.incrementAndGet();
                    throw new IllegalStateException("sensor glitch");
                }));

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitError());

        Thread.sleep(50);
        assertTrue(ticks.get() >= 2, "Timer keeps running after a failing tick");
        assertEquals("sensor glitch", host.errors().get(0).fault().getMessage());
        assertEquals(0, host.terminations());
    }

    @Test
    void deactivateTimeoutIsReported() throws InterruptedException {
        config = OperatorRuntimeConfig.builder().withDeactivateTimeout(Duration.ofMillis(100)).build();
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("slow", host);
        CountDownLatch teardownRelease = new CountDownLatch(1);
        ScriptedOperator op = new ScriptedOperator().blockTeardown(teardownRelease);

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitReady());

        try {
            long before = System.nanoTime();
            runtime.deactivate();
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - before);
            assertTrue(elapsedMillis < 1000, "Bounded wait returns");

            assertEquals(1, host.errors().size());
            assertTrue(host.errors().get(0).message().contains("did not stop"));
            assertEquals(ErrorKind.DEACTIVATE_TIMEOUT, sink.getErrors().get(0).kind());
            assertEquals(0, runGate.count());
        } finally {
            teardownRelease.countDown();
        }
    }

    @Test
    void errorThrownByPrepareIsFatal() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator().failPrepare(new AssertionError("device assertion"));

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitTerminate());
        awaitDispatcherIdle();

        assertEquals(1, host.terminations());
        assertEquals(1, host.errors().size());
        assertEquals("device assertion", host.errors().get(0).message());
        assertEquals(0, runGate.count());
        assertEquals(OperatorState.FAILED, runtime.state());
        assertEquals(ErrorKind.PREPARE_FAULT, sink.getErrors().get(0).kind());
    }

    @Test
    void errorThrownByTaskOrTeardownIsReported() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator op = new ScriptedOperator().failTeardown(new LinkageError("driver missing"));

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitReady());

        assertTrue(runtime.submit(() -> {
            throw new AssertionError("bad reading");
        }));
        assertTrue(host.awaitError());
        awaitDispatcherIdle();
        assertEquals(0, host.terminations());

        runtime.deactivate();

        List<InstrumentErrorEvent> errors = sink.getErrors();
        assertEquals(2, errors.size());
        assertEquals(ErrorKind.STRUCTURED, errors.get(0).kind());
        assertEquals("bad reading", errors.get(0).message());
        assertEquals(ErrorKind.FINALIZE_FAULT, errors.get(1).kind());
        assertEquals("driver missing", errors.get(1).message());
        assertEquals(OperatorState.FINALIZED, runtime.state());
    }

    @Test
    void operatorBlockedAfterFatalErrorDoesNotHoldUpOtherDevices() throws InterruptedException {
        RecordingHost<String> hostX = new RecordingHost<>();
        RecordingHost<String> hostY = new RecordingHost<>();
        OperatorRuntime<String, String> x = runtime("X", hostX);
        OperatorRuntime<String, String> y = runtime("Y", hostY);
        CountDownLatch hardware = new CountDownLatch(1);
        ScriptedOperator opX = new ScriptedOperator().onPrepare(ctx -> {
            ctx.reportError("cable unplugged", null);
            try {
                hardware.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            x.activate(args -> opX, "x");
            assertTrue(hostX.awaitTerminate(), "Fatal error handled while prepare still blocks");
            assertEquals(0, runGate.count());

            long before = System.nanoTime();
            y.activate(args -> new ScriptedOperator(), "y");
            assertTrue(hostY.awaitReady());
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - before);
            assertTrue(elapsedMillis < 1000, "Y became ready after " + elapsedMillis + " ms");
            assertEquals(0, opX.teardowns.get());
        } finally {
            hardware.countDown();
        }

        x.deactivate();
        assertEquals(1, opX.teardowns.get());
        assertEquals(1, hostX.errors().size());
        assertTrue(hostX.readyResults().isEmpty());
    }

    @Test
    void interruptedCallerStillWaitsForTeardown() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        CountDownLatch teardownRelease = new CountDownLatch(1);
        ScriptedOperator op = new ScriptedOperator().blockTeardown(teardownRelease);

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitReady());

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            teardownRelease.countDown();
        });
        releaser.start();

        Thread.currentThread().interrupt();
        runtime.deactivate();

        assertTrue(Thread.interrupted(), "Interrupt status is kept");
        assertEquals(0, teardownRelease.getCount(), "Returned only after teardown was let go");
        assertEquals(OperatorState.FINALIZED, runtime.state());
        assertTrue(host.errors().isEmpty(), "No timeout reported without a bound");
        assertTrue(sink.getErrors().isEmpty());
        releaser.join(1000);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Test
    void secondActivationWhileLiveIsRejected() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);

        runtime.activate(args -> new ScriptedOperator(), "a");
        assertThrows(IllegalStateException.class, () -> runtime.activate(args -> new ScriptedOperator(), "b"));
        assertTrue(host.awaitReady());
        awaitDispatcherIdle();
        assertEquals(0, runGate.count());
        assertEquals(1, runtime.cycle());

        runtime.deactivate();
        ScriptedOperator third = new ScriptedOperator().blockPrepare();
        runtime.activate(args -> third, "c");
        assertEquals(2, runtime.cycle());
        assertFalse(runtime.preparedCompleted(), "Fresh cycle starts unprepared");
        third.proceed.countDown();
    }

    @Test
    void factoryFailureReleasesGate() {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> runtime.activate(args -> {
                    throw new IllegalArgumentException("bad args");
                }, "a"));

        assertEquals("bad args", ex.getMessage());
        assertEquals(0, runGate.count());
        assertFalse(runtime.isActive());
    }

    @Test
    void eventsFromEarlierCycleAreDropped() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        ScriptedOperator first = new ScriptedOperator();

        runtime.activate(args -> first, "a");
        assertTrue(host.awaitReady());
        runtime.deactivate();

        runtime.activate(args -> new ScriptedOperator(), "b");
        first.context.reportError("stale", null);
        awaitDispatcherIdle();

        assertTrue(host.errors().isEmpty());
    }

    @Test
    void timersAreCancelledBeforeTeardown() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);
        AtomicInteger ticks = new AtomicInteger();
        AtomicInteger ticksAtTeardown = new AtomicInteger(-1);
        ScriptedOperator op = new ScriptedOperator()
                .onPrepare(ctx -> ctx.scheduler().scheduleAtFixedRate(Duration.ofMillis(5), ticks::incrementAndGet))
                .onTeardown(() -> ticksAtTeardown.set(ticks.get()));

        runtime.activate(args -> op, "a");
        assertTrue(host.awaitReady());
        Thread.sleep(50);

        runtime.deactivate();
        Thread.sleep(50);

        assertTrue(ticksAtTeardown.get() > 0);
        assertEquals(ticksAtTeardown.get(), ticks.get(), "No tick after teardown");
        assertFalse(runtime.submit(() -> {}), "Nothing runs on a stopped worker");
    }

    @Test
    void reportsOperatorTransitions() throws InterruptedException {
        RecordingHost<String> host = new RecordingHost<>();
        OperatorRuntime<String, String> runtime = runtime("dev", host);

        runtime.activate(args -> new ScriptedOperator(), "a");
        assertTrue(host.awaitReady());
        runtime.deactivate();

        List<OperatorState> path = new ArrayList<>();
        List<OperatorTransitionEvent> transitions = sink.getOperatorTransitions("dev");
        path.add(transitions.get(0).from());
        transitions.forEach(t -> path.add(t.to()));

        assertEquals(List.of(
                OperatorState.CREATED,
                OperatorState.STARTING,
                OperatorState.READY,
                OperatorState.ACTIVE,
                OperatorState.STOPPING,
                OperatorState.FINALIZED), path);
        assertTrue(transitions.stream().allMatch(t -> t.cycle() == 1));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private <R> OperatorRuntime<String, R> runtime(String name, RecordingHost<R> host) {
        OperatorRuntime<String, R> runtime = new OperatorRuntime<>(name, host, runGate, dispatcher, config, sink);
        runtimes.add(runtime);
        return runtime;
    }

    /** Returns once every task posted so far has been handled. */
    private void awaitDispatcherIdle() throws InterruptedException {
        CountDownLatch idle = new CountDownLatch(1);
        assertTrue(dispatcher.post(idle::countDown));
        assertTrue(idle.await(2, TimeUnit.SECONDS));
    }

    private static final class ScriptedOperator implements Operator<String, String> {
        final CountDownLatch prepareEntered = new CountDownLatch(1);
        final AtomicInteger teardowns = new AtomicInteger();
        volatile OperatorContext context;
        CountDownLatch proceed;
        Throwable prepareFault;
        Throwable teardownFault;
        CountDownLatch teardownBlock;
        Consumer<OperatorContext> onPrepare = ctx -> {};
        Runnable onTeardown = () -> {};

        ScriptedOperator blockPrepare() {
            this.proceed = new CountDownLatch(1);
            return this;
        }

        ScriptedOperator failPrepare(Throwable fault) {
            this.prepareFault = fault;
            return this;
        }

        ScriptedOperator failTeardown(Throwable fault) {
            this.teardownFault = fault;
            return this;
        }

        ScriptedOperator blockTeardown(CountDownLatch release) {
            this.teardownBlock = release;
            return this;
        }

        ScriptedOperator onPrepare(Consumer<OperatorContext> action) {
            this.onPrepare = action;
            return this;
        }

        ScriptedOperator onTeardown(Runnable action) {
            this.onTeardown = action;
            return this;
        }

        @Override
        public String prepare(OperatorContext context, String args) throws Exception {
            this.context = context;
            prepareEntered.countDown();
            if (proceed != null) {
                assertTrue(proceed.await(5, TimeUnit.SECONDS));
            }
            if (prepareFault != null) {
                throw rethrowable(prepareFault);
            }
            onPrepare.accept(context);
            return args + "-ready";
        }

        @Override
        public void teardown() throws Exception {
            teardowns.incrementAndGet();
            onTeardown.run();
            if (teardownBlock != null) {
                teardownBlock.await(5, TimeUnit.SECONDS);
            }
            if (teardownFault != null) {
                throw rethrowable(teardownFault);
            }
        }

        private static Exception rethrowable(Throwable fault) {
            if (fault instanceof Error e) {
                throw e;
            }
            return (Exception) fault;
        }
    }
}
