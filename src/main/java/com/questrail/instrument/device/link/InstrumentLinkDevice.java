package com.questrail.instrument.device.link;

import com.questrail.instrument.api.DataChannel;
import com.questrail.instrument.api.DeviceErrorSurface;
import com.questrail.instrument.device.AbstractOperatorDevice;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.runtime.InstrumentRuntime;
import com.questrail.instrument.transport.DatagramEndpoint;
import com.questrail.instrument.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Device for a networked instrument. Activation performs the identification
 * handshake on the worker; the identity is available once the device is ready.
 */
public class InstrumentLinkDevice extends AbstractOperatorDevice<InstrumentEndpointSettings, InstrumentIdentity> {

    private final Function<InetSocketAddress, DatagramEndpoint> endpointFactory;
    private final DataChannel<byte[]> replies;

    private volatile DatagramInstrumentOperator operator;
    private volatile InstrumentIdentity identity;

    public InstrumentLinkDevice(
            String name,
            InstrumentRuntime runtime,
            DeviceErrorSurface errorSurface,
            DataChannel<byte[]> replies,
            Function<InetSocketAddress, DatagramEndpoint> endpointFactory) {
        super(name, runtime, errorSurface);
        this.replies = Objects.requireNonNull(replies, "replies");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
    }

    /**
     * Device using a Netty UDP endpoint.
     */
    public InstrumentLinkDevice(String name, InstrumentRuntime runtime, DeviceErrorSurface errorSurface,
                                DataChannel<byte[]> replies) {
        this(name, runtime, errorSurface, replies, NettyUdpDatagramEndpoint::new);
    }

    @Override
    protected Operator<InstrumentEndpointSettings, InstrumentIdentity> createOperator(
            InstrumentEndpointSettings settings) {
        Objects.requireNonNull(settings, "settings");
        identity = null;
        DatagramInstrumentOperator op = new DatagramInstrumentOperator(endpointFactory, replies);
        operator = op;
        return op;
    }

    @Override
    public void operatorReady(InstrumentIdentity result) {
        identity = result;
    }

    public Optional<InstrumentIdentity> identity() {
        return Optional.ofNullable(identity);
    }

    /**
     * Queues an ASCII command for the instrument.
     *
     * @return {@code false} if no operator is live
     */
    public boolean sendCommand(String command) {
        Objects.requireNonNull(command, "command");
        DatagramInstrumentOperator op = operator;
        if (op == null) {
            return false;
        }
        byte[] payload = command.getBytes(StandardCharsets.US_ASCII);
        return submitToOperator(() -> op.send(payload));
    }

    @Override
    protected void onKilled() {
        identity = null;
        replies.close();
    }
}
