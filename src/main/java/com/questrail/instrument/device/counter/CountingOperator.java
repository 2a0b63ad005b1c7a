package com.questrail.instrument.device.counter;

import com.questrail.instrument.api.DataChannel;
import com.questrail.instrument.internal.time.Cancellable;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.operator.OperatorContext;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * CountingOperator
 * =============================================================================
 * Reads a {@link CountSource} while a measurement step is running.
 *
 * <h2>Per step</h2>
 * <pre>
 *   measuringStarted()   step total = 0, tick armed at the prepare interval
 *   tick                 read, add to total, publish rate (counts/s) from the
 *                        second tick on
 *   measuringStopped()   tick cancelled, one last read, publish step total
 * </pre>
 *
 * <h2>Threading</h2>
 * <p>All methods run on the worker. The device reaches
 * {@link #measuringStarted()} and {@link #measuringStopped()} through the
 * runtime's {@code submit}, so no field here is shared.</p>
 */
public final class CountingOperator implements Operator<Duration, Void> {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final CountSource source;
    private final DataChannel<Long> rate;
    private final DataChannel<Long> counts;

    private OperatorContext context;
    private Duration interval;
    private Cancellable tick;

    private long stepCounts;
    private long lastTickNanos;
    private boolean ticked;

    public CountingOperator(CountSource source, DataChannel<Long> rate, DataChannel<Long> counts) {
        this.source = Objects.requireNonNull(source, "source");
        this.rate = Objects.requireNonNull(rate, "rate");
        this.counts = Objects.requireNonNull(counts, "counts");
    }

    /**
     * @param interval rate tick period
     */
    @Override
    public Void prepare(OperatorContext context, Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.context = context;
        this.interval = interval;
        return null;
    }

    public void measuringStarted() {
        stopTick();
        stepCounts = 0;
        ticked = false;
        tick = context.scheduler().scheduleAtFixedRate(interval, this::measuringTick);
    }

    void measuringTick() {
        long value;
        try {
            value = source.read();
        } catch (IOException e) {
            context.reportException(e);
            return;
        }
        long now = context.clock().nowNanos();
        stepCounts += value;

        if (ticked) {
            long elapsed = now - lastTickNanos;
            if (elapsed > 0) {
                rate.addData((long) (value * NANOS_PER_SECOND / elapsed));
            }
        }
        lastTickNanos = now;
        ticked = true;
    }

    /**
     * Ends the step and publishes its total. A failing final read is reported
     * and the total read so far is published.
     */
    public void measuringStopped() {
        stopTick();
        try {
            stepCounts += source.read();
        } catch (IOException e) {
            context.reportException(e);
        }
        counts.addData(stepCounts);
    }

    private void stopTick() {
        Cancellable t = tick;
        if (t != null) {
            t.cancel();
            tick = null;
        }
    }

    long stepCounts() {
        return stepCounts;
    }
}
