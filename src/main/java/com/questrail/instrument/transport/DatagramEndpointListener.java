package com.questrail.instrument.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are serialized by the endpoint but arrive on the endpoint's own
 * thread, not on the operator's worker. Listeners hand data over through
 * thread-safe structures.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause failure, or {@code null} for an orderly stop
     */
    void onTransportDown(Throwable cause);

    /**
     * One whole datagram, copied out of any framework buffer.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
