package com.questrail.instrument.device.sampler;

/**
 * Where a sampler's values come from. {@link #sample()} runs on the operator's
 * worker and may block.
 */
@FunctionalInterface
public interface SampleSource
{
    double sample() throws Exception;
}
