package com.questrail.instrument.time;

import com.questrail.instrument.internal.time.Cancellable;
import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler driven by a {@link ManualMonotonicClock}.
 *
 * Tasks run ONLY when {@link #runDueTasks()} is called, on the calling thread.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task, 0, new AtomicBoolean(false));
        queue.add(scheduled);
        return scheduled;
    }

    @Override
    public synchronized Cancellable scheduleAtFixedRate(Duration period, Runnable task) {
        long periodNanos = period.toNanos();
        Scheduled scheduled = new Scheduled(
                clock.nowNanos() + periodNanos, sequence++, task, periodNanos, new AtomicBoolean(false));
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time, in deadline order.
     */
    public void runDueTasks() {
        while (true) {
            Scheduled next;
            synchronized (this) {
                if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
                    return;
                }
                next = queue.poll();
                if (next.periodNanos > 0 && !next.cancelled.get()) {
                    queue.add(new Scheduled(next.deadlineNanos + next.periodNanos, sequence++,
                            next.task, next.periodNanos, next.cancelled));
                }
            }
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    public synchronized int pendingCount() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long seq;
        private final Runnable task;
        private final long periodNanos;
        private final AtomicBoolean cancelled;

        private Scheduled(long deadlineNanos, long seq, Runnable task, long periodNanos, AtomicBoolean cancelled) {
            this.deadlineNanos = deadlineNanos;
            this.seq = seq;
            this.task = task;
            this.periodNanos = periodNanos;
            this.cancelled = cancelled;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int c = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return c != 0 ? c : Long.compare(this.seq, o.seq);
        }
    }
}
