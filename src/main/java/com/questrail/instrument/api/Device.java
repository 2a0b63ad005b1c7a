package com.questrail.instrument.api;

/**
 * A named plugin attached to the measurement engine.
 */
public interface Device
{
    String name();

    /**
     * Tear the device down. Safe to call more than once.
     */
    void kill();

    boolean isKilled();
}
