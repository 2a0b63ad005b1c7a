package com.questrail.instrument.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram link to a networked instrument.
 *
 * <p>The endpoint moves bytes only. Framing, identification and any retry
 * policy belong to the operator that owns it. Implementations may be backed by
 * Netty or by a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind and begin receiving.
     *
     * <p>Binding may complete asynchronously; the listener hears
     * {@link DatagramEndpointListener#onTransportUp()} once the endpoint is
     * usable, or {@link DatagramEndpointListener#onTransportDown(Throwable)} if
     * binding failed.</p>
     */
    void start();

    /**
     * Release all transport resources. Returns once they are released.
     *
     * <p>The listener hears {@code onTransportDown} at most once per up/down
     * transition.</p>
     */
    void stop();

    /**
     * Send one datagram.
     *
     * @return {@code false} if the endpoint is not up; nothing is queued
     */
    boolean send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
