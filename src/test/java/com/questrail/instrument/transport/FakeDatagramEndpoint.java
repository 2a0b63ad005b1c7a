package com.questrail.instrument.transport;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint}.
 *
 * <p>Stores outbound datagrams and lets tests inject inbound ones. An optional
 * responder sees every send and may answer through {@link #injectDatagram}.
 * Methods are synchronized because operators call it from their worker while
 * tests inspect it from the test thread.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    public record Sent(SocketAddress remote, byte[] payload) {}

    private final List<Sent> sent = new ArrayList<>();
    private final boolean comesUp;

    private volatile DatagramEndpointListener listener;
    private volatile BiConsumer<FakeDatagramEndpoint, Sent> responder;
    private boolean up;
    private int stopCount;

    public FakeDatagramEndpoint() {
        this(true);
    }

    /**
     * @param comesUp {@code false} simulates an endpoint that never binds
     */
    public FakeDatagramEndpoint(boolean comesUp) {
        this.comesUp = comesUp;
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (!comesUp) {
            return;
        }
        synchronized (this) {
            up = true;
        }
        DatagramEndpointListener l = listener;
        if (l != null) {
            l.onTransportUp();
        }
    }

    @Override
    public void stop() {
        boolean wasUp;
        synchronized (this) {
            wasUp = up;
            up = false;
            stopCount++;
        }
        DatagramEndpointListener l = listener;
        if (wasUp && l != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public boolean send(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        Sent s = new Sent(remote, payload);
        synchronized (this) {
            if (!up) {
                return false;
            }
            sent.add(s);
        }
        BiConsumer<FakeDatagramEndpoint, Sent> r = responder;
        if (r != null) {
            r.accept(this, s);
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void respondWith(BiConsumer<FakeDatagramEndpoint, Sent> responder) {
        this.responder = responder;
    }

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        l.onDatagram(remote, payload);
    }

    /** Simulates the link dropping underneath the operator. */
    public void dropTransport(Throwable cause) {
        synchronized (this) {
            up = false;
        }
        DatagramEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    public synchronized List<Sent> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized int stopCount() {
        return stopCount;
    }

    public synchronized boolean isUp() {
        return up;
    }
}
