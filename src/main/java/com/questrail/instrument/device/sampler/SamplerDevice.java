package com.questrail.instrument.device.sampler;

import com.questrail.instrument.api.DataChannel;
import com.questrail.instrument.api.DeviceErrorSurface;
import com.questrail.instrument.device.AbstractOperatorDevice;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.runtime.InstrumentRuntime;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Device publishing periodic samples to a channel.
 *
 * <p>The sample source is chosen per activation, so the same device can be
 * re-activated with different settings. The channel is closed when the device
 * is killed.</p>
 */
public class SamplerDevice extends AbstractOperatorDevice<SamplerSettings, Void> {

    private final DataChannel<Double> samples;
    private final Function<SamplerSettings, SampleSource> sourceFactory;
    private final AtomicLong readyCount = new AtomicLong();

    public SamplerDevice(
            String name,
            InstrumentRuntime runtime,
            DeviceErrorSurface errorSurface,
            DataChannel<Double> samples,
            Function<SamplerSettings, SampleSource> sourceFactory) {
        super(name, runtime, errorSurface);
        this.samples = Objects.requireNonNull(samples, "samples");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
    }

    /**
     * Sampler backed by {@link RandomSampleSource}.
     */
    public SamplerDevice(String name, InstrumentRuntime runtime, DeviceErrorSurface errorSurface,
                         DataChannel<Double> samples) {
        this(name, runtime, errorSurface, samples, RandomSampleSource::new);
    }

    @Override
    protected Operator<SamplerSettings, Void> createOperator(SamplerSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return new PeriodicSamplerOperator(sourceFactory.apply(settings), samples);
    }

    @Override
    public void operatorReady(Void result) {
        readyCount.incrementAndGet();
    }

    /** How many activations have reached readiness. */
    public long readyCount() {
        return readyCount.get();
    }

    @Override
    protected void onKilled() {
        samples.close();
    }
}
