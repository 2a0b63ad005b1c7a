package com.questrail.instrument.device.link;

import com.questrail.instrument.api.DataChannel;
import com.questrail.instrument.transport.DatagramEndpoint;
import com.questrail.instrument.transport.DatagramEndpointListener;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * DatagramInstrumentOperator
 * =============================================================================
 * Operator for an instrument reached over UDP.
 *
 * <h2>Handshake</h2>
 * <ol>
 *   <li>Bind the endpoint and wait for transport-up.</li>
 *   <li>Send the identify command to the instrument.</li>
 *   <li>Wait for the first datagram from the instrument's address and parse
 *       it as an {@link InstrumentIdentity}.</li>
 * </ol>
 * Each wait is bounded by the handshake timeout; running out fails
 * {@code prepare} with an {@link InstrumentHandshakeException}.
 *
 * <h2>After the handshake</h2>
 * <p>Datagrams from the instrument are published to the output channel from
 * the worker. Datagrams from any other address are ignored. A transport drop
 * is reported as an error; the device stays up.</p>
 */
public final class DatagramInstrumentOperator
        extends HardwareOperator<InstrumentEndpointSettings, InstrumentIdentity> {

    private final Function<InetSocketAddress, DatagramEndpoint> endpointFactory;
    private final DataChannel<byte[]> output;

    private final CountDownLatch transportUp = new CountDownLatch(1);
    private final BlockingQueue<byte[]> handshakeReplies = new LinkedBlockingQueue<>();

    private volatile DatagramEndpoint endpoint;
    private volatile InetSocketAddress instrument;
    private volatile Throwable bindFailure;
    private volatile boolean identified;

    /**
     * @param endpointFactory builds an endpoint bound to the given local address
     * @param output          receives every datagram the instrument sends once
     *                        identified
     */
    public DatagramInstrumentOperator(
            Function<InetSocketAddress, DatagramEndpoint> endpointFactory,
            DataChannel<byte[]> output) {
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.output = Objects.requireNonNull(output, "output");
    }

    @Override
    protected void connect(InstrumentEndpointSettings settings) throws Exception {
        instrument = settings.instrumentAddress();

        DatagramEndpoint ep = Objects.requireNonNull(
                endpointFactory.apply(settings.bindAddress()), "endpoint");
        ep.setListener(new Listener());
        endpoint = ep;
        ep.start();

        if (!transportUp.await(settings.handshakeTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
            throw new InstrumentHandshakeException(
                    "Endpoint did not come up within " + settings.handshakeTimeout());
        }
        Throwable failure = bindFailure;
        if (failure != null) {
            throw new InstrumentHandshakeException("Could not bind " + settings.bindAddress(), failure);
        }
    }

    @Override
    protected InstrumentIdentity handshake(InstrumentEndpointSettings settings) throws Exception {
        if (!endpoint.send(settings.instrumentAddress(), settings.identifyPayload())) {
            throw new InstrumentHandshakeException("Endpoint went down before the identify command was sent");
        }

        Duration timeout = settings.handshakeTimeout();
        byte[] reply = handshakeReplies.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (reply == null) {
            throw new InstrumentHandshakeException(
                    "No identification from " + settings.instrumentAddress() + " within " + timeout);
        }

        InstrumentIdentity identity = InstrumentIdentity.parse(new String(reply, StandardCharsets.US_ASCII));
        identified = true;
        return identity;
    }

    @Override
    protected void disconnect() {
        identified = false;
        DatagramEndpoint ep = endpoint;
        endpoint = null;
        if (ep != null) {
            ep.stop();
        }
    }

    /**
     * Sends a raw command to the instrument. Call on the worker, after
     * readiness. A command that cannot be sent is reported as an error.
     *
     * @return {@code false} if the link is not up
     */
    public boolean send(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        DatagramEndpoint ep = endpoint;
        if (ep != null && identified && ep.send(instrument, payload)) {
            return true;
        }
        context().reportError("Command not sent, link to instrument is down",
                new String(payload, StandardCharsets.US_ASCII));
        return false;
    }

    private void publish(byte[] payload) {
        context().scheduler().scheduleAfter(Duration.ZERO, context().clock(), () -> output.addData(payload));
    }

    private final class Listener implements DatagramEndpointListener {
        @Override
        public void onTransportUp() {
            transportUp.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause) {
            if (cause != null && transportUp.getCount() > 0) {
                bindFailure = cause;
                transportUp.countDown();
                return;
            }
            if (identified) {
                context().reportError("Link to instrument " + instrument + " lost", cause);
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            if (!remote.equals(instrument)) {
                return;
            }
            if (identified) {
                publish(payload);
            } else {
                handshakeReplies.offer(payload);
            }
        }
    }
}
