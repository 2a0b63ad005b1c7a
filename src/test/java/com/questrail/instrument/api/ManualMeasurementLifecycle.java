package com.questrail.instrument.api;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Measurement lifecycle a test drives by hand.
 */
public final class ManualMeasurementLifecycle implements MeasurementLifecycle {

    private final List<MeasurementListener> listeners = new CopyOnWriteArrayList<>();
    private final CountDownLatch firstConnect = new CountDownLatch(1);

    @Override
    public void connect(MeasurementListener listener) {
        listeners.add(listener);
        firstConnect.countDown();
    }

    @Override
    public void disconnect(MeasurementListener listener) {
        listeners.remove(listener);
    }

    public void fireStarted() {
        listeners.forEach(MeasurementListener::started);
    }

    public void fireStopped() {
        listeners.forEach(MeasurementListener::stopped);
    }

    /** Waits for the first listener to connect. */
    public boolean awaitConnected() throws InterruptedException {
        return firstConnect.await(2, TimeUnit.SECONDS);
    }

    public int listenerCount() {
        return listeners.size();
    }
}
