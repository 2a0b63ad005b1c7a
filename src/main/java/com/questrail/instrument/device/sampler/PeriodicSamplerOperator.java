package com.questrail.instrument.device.sampler;

import com.questrail.instrument.api.DataChannel;
import com.questrail.instrument.internal.time.Cancellable;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.operator.OperatorContext;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PeriodicSamplerOperator
 * -----------------------------------------------------------------------------
 * Reads its {@link SampleSource} once per interval and publishes each value to
 * an output channel.
 *
 * <p>{@code prepare} only arms the timer, so readiness is immediate. The first
 * sample follows one interval later. Samples are steady-state output and have
 * nothing to do with the ready/error handshake; a source that fails on a tick
 * is reported through the context and the timer keeps running.</p>
 */
public final class PeriodicSamplerOperator implements Operator<SamplerSettings, Void> {

    private final SampleSource source;
    private final DataChannel<Double> output;
    private final AtomicLong emitted = new AtomicLong();

    private OperatorContext context;
    private Cancellable timer;

    public PeriodicSamplerOperator(SampleSource source, DataChannel<Double> output) {
        this.source = Objects.requireNonNull(source, "source");
        this.output = Objects.requireNonNull(output, "output");
    }

    @Override
    public Void prepare(OperatorContext context, SamplerSettings settings) {
        this.context = context;
        this.timer = context.scheduler().scheduleAtFixedRate(settings.interval(), this::tick);
        return null;
    }

    private void tick() {
        double value;
        try {
            value = source.sample();
        } catch (Exception e) {
            context.reportException(e);
            return;
        }
        output.addData(value);
        emitted.incrementAndGet();
    }

    @Override
    public void teardown() {
        Cancellable t = timer;
        if (t != null) {
            t.cancel();
        }
    }

    /** Number of samples published so far. */
    public long emitted() {
        return emitted.get();
    }
}
