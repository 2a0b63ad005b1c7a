package com.questrail.instrument.device.counter;

import java.io.IOException;

/**
 * Hardware counter. Each read returns the counts accumulated since the
 * previous read. Reads run on the operator's worker and may block.
 */
@FunctionalInterface
public interface CountSource
{
    long read() throws IOException;
}
