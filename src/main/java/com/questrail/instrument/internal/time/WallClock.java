package com.questrail.instrument.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of human-readable timestamps for error and transition events.
 * Never used to decide when anything runs.
 */
public interface WallClock
{
    Instant now();
}
