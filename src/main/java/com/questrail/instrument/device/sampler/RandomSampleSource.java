package com.questrail.instrument.device.sampler;

import java.util.Objects;
import java.util.Random;

/**
 * Synthetic source yielding {@code amplitude * u + offset} for uniform
 * {@code u} in [0, 1).
 */
public final class RandomSampleSource implements SampleSource {

    private final double amplitude;
    private final double offset;
    private final Random random;

    public RandomSampleSource(SamplerSettings settings, Random random) {
        Objects.requireNonNull(settings, "settings");
        this.amplitude = settings.amplitude();
        this.offset = settings.offset();
        this.random = Objects.requireNonNull(random, "random");
    }

    public RandomSampleSource(SamplerSettings settings) {
        this(settings, new Random());
    }

    @Override
    public double sample() {
        return amplitude * random.nextDouble() + offset;
    }
}
