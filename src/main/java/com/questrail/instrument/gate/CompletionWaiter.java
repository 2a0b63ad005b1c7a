package com.questrail.instrument.gate;

import com.questrail.instrument.internal.time.Cancellable;
import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CompletionWaiter
 * =============================================================================
 * Controller-side reader of a {@link CompletionGate}: defers an action until the
 * gate is observed at zero.
 *
 * <h2>Polling</h2>
 * <p>The first check happens one poll interval after {@link #whenClear} is
 * called, giving devices that react to the preceding run/step notification a
 * chance to acquire the gate first. Every check that finds the gate held
 * schedules another check, so an acquire that sneaks in between two checks is
 * simply seen at the next one.</p>
 */
public final class CompletionWaiter {

    /** Re-check cadence used when none is configured. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration pollInterval;

    public CompletionWaiter(MonotonicScheduler scheduler, MonotonicClock clock, Duration pollInterval) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public CompletionWaiter(MonotonicScheduler scheduler, MonotonicClock clock) {
        this(scheduler, clock, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Runs {@code action} once, on the scheduler's thread, at the first poll
     * that finds {@code gate} at zero.
     *
     * @return handle that stops further polling; cancelling after the action
     *         ran returns {@code false}
     */
    public Cancellable whenClear(CompletionGate gate, Runnable action) {
        Objects.requireNonNull(gate, "gate");
        Objects.requireNonNull(action, "action");

        Poll poll = new Poll(gate, action);
        poll.arm();
        return poll;
    }

    private final class Poll implements Cancellable, Runnable {
        private final CompletionGate gate;
        private final Runnable action;
        private final AtomicBoolean done = new AtomicBoolean(false);
        private volatile Cancellable pending;

        private Poll(CompletionGate gate, Runnable action) {
            this.gate = gate;
            this.action = action;
        }

        void arm() {
            pending = scheduler.scheduleAfter(pollInterval, clock, this);
        }

        @Override
        public void run() {
            if (done.get()) {
                return;
            }
            if (gate.count() > 0) {
                arm();
                return;
            }
            if (done.compareAndSet(false, true)) {
                action.run();
            }
        }

        @Override
        public boolean cancel() {
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            Cancellable p = pending;
            if (p != null) {
                p.cancel();
            }
            return true;
        }
    }
}
