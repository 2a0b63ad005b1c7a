package com.questrail.instrument.device.sampler;

import java.time.Duration;
import java.util.Objects;

/**
 * Arguments of a periodic sampler.
 *
 * @param interval  time between samples
 * @param amplitude scale of a synthetic sample
 * @param offset    shift of a synthetic sample
 */
public record SamplerSettings(Duration interval, double amplitude, double offset) {

    public SamplerSettings {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /** One sample every 3 s, amplitude 100, offset 0. */
    public static SamplerSettings defaults() {
        return new SamplerSettings(Duration.ofSeconds(3), 100.0, 0.0);
    }

    public SamplerSettings withInterval(Duration interval) {
        return new SamplerSettings(interval, amplitude, offset);
    }
}
