package com.questrail.instrument.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for every operational delay in the runtime: sampler periods,
 * gate re-check intervals and handshake timeouts.
 *
 * <p>Wall-clock time is reserved for event timestamps; see {@link WallClock}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only the
     * difference between two readings is meaningful.
     */
    long nowNanos();
}
