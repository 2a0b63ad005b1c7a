package com.questrail.instrument.device.link;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Where and how to reach a networked instrument.
 *
 * @param bindAddress        local address to bind; port 0 picks any
 * @param instrumentAddress  the instrument
 * @param handshakeTimeout   bound on each handshake wait (bind, reply)
 * @param identifyCommand    query sent to make the instrument identify itself
 */
public record InstrumentEndpointSettings(
        InetSocketAddress bindAddress,
        InetSocketAddress instrumentAddress,
        Duration handshakeTimeout,
        String identifyCommand
) {
    public static final String DEFAULT_IDENTIFY_COMMAND = "*IDN?\n";
    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(2);

    public InstrumentEndpointSettings {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(instrumentAddress, "instrumentAddress");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(identifyCommand, "identifyCommand");
        if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
            throw new IllegalArgumentException("handshakeTimeout must be positive");
        }
    }

    /**
     * Any local port, 2 s handshake timeout, {@code *IDN?} query.
     */
    public static InstrumentEndpointSettings of(InetSocketAddress instrumentAddress) {
        return new InstrumentEndpointSettings(
                new InetSocketAddress(0), instrumentAddress, DEFAULT_HANDSHAKE_TIMEOUT, DEFAULT_IDENTIFY_COMMAND);
    }

    public byte[] identifyPayload() {
        return identifyCommand.getBytes(StandardCharsets.US_ASCII);
    }
}
