package com.questrail.instrument.internal.exec;

import com.questrail.instrument.internal.events.ErrorKind;
import com.questrail.instrument.internal.time.SystemWallClock;
import com.questrail.instrument.observability.InstrumentErrorEvent;
import com.questrail.instrument.observability.InstrumentObservabilitySink;
import com.questrail.instrument.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * ControllerDispatcher
 * =============================================================================
 * The coordinating execution context: a single thread draining a bounded
 * channel of tasks posted by operator workers.
 *
 * <h2>Purpose</h2>
 * Every readiness and error event leaves its worker through this channel and
 * is handled here, one at a time, in posting order. Device callbacks
 * ({@code operatorReady}, {@code showError}, {@code terminate}) therefore
 * always run on this thread and never concurrently with each other.
 *
 * <h2>Back-pressure</h2>
 * The channel is bounded. A worker posting into a full channel waits, in short
 * slices, until there is room, the dispatcher stops, or the worker's abandon
 * condition becomes true. The dispatch thread itself never waits on the
 * channel.
 *
 * <h2>Fault isolation</h2>
 * A task that throws is reported to the observability sink as a
 * {@link ErrorKind#HANDLER_FAULT} and the loop carries on.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   dispatcher.start()      → starts the dispatch thread
 *   dispatcher.post(...)    → enqueues a task
 *   dispatcher.stop()       → stops the loop; pending tasks are discarded
 * </pre>
 */
public final class ControllerDispatcher {

    private static final long POST_SLICE_MILLIS = 10;

    private final BlockingQueue<Runnable> channel;
    private final InstrumentObservabilitySink observabilitySink;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread dispatchThread;

    /**
     * @param capacity          channel bound, at least 1
     * @param observabilitySink receives handler faults; {@code null} for none
     */
    public ControllerDispatcher(int capacity, InstrumentObservabilitySink observabilitySink) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.channel = new ArrayBlockingQueue<>(capacity);
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the dispatch thread. Calling it again while running has no effect.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            dispatchThread = new Thread(this::runDispatchLoop, "instrument-controller");
            dispatchThread.setDaemon(true);
            dispatchThread.start();
        }
    }

    /**
     * Stops the dispatch loop and waits up to five seconds for the thread to end.
     * Tasks still queued are discarded.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = dispatchThread;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            channel.clear();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns whether the calling thread is the dispatch thread.
     */
    public boolean isDispatchThread() {
        return Thread.currentThread() == dispatchThread;
    }

    /**
     * Posts a task, waiting for room if the channel is full.
     *
     * @return {@code true} once the task is queued; {@code false} if the
     *         dispatcher is not running or the caller was interrupted
     */
    public boolean post(Runnable task) {
        return post(task, () -> false);
    }

    /**
     * Posts a task, waiting for room if the channel is full, unless
     * {@code abandon} turns true first.
     *
     * @param abandon polled between attempts; {@code true} gives up
     * @return {@code true} once the task is queued; {@code false} if it was
     *         abandoned, the dispatcher is not running, or the caller was
     *         interrupted
     */
    public boolean post(Runnable task, BooleanSupplier abandon) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(abandon, "abandon");

        while (running.get()) {
            if (abandon.getAsBoolean()) {
                return false;
            }
            try {
                if (channel.offer(task, POST_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    /**
     * Queues a task only if there is room right now. Never waits.
     *
     * @return {@code false} if the dispatcher is not running or the channel
     *         is full
     */
    public boolean offer(Runnable task) {
        Objects.requireNonNull(task, "task");
        return running.get() && channel.offer(task);
    }

    private void runDispatchLoop() {
        while (running.get()) {
            try {
                Runnable task = channel.take();
                if (running.get()) {
                    task.run();
                }
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
            } catch (Exception e) {
                observabilitySink.onError(new InstrumentErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "controller",
                    ErrorKind.HANDLER_FAULT,
                    "Controller task failed",
                    e,
                    false
                ));
            }
        }
    }
}
