package com.questrail.instrument.device.link;

import java.util.Objects;

/**
 * Identification an instrument returns to {@code *IDN?}: manufacturer, model,
 * serial number and firmware revision, comma separated.
 */
public record InstrumentIdentity(String manufacturer, String model, String serial, String firmware) {

    public InstrumentIdentity {
        Objects.requireNonNull(manufacturer, "manufacturer");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(serial, "serial");
        Objects.requireNonNull(firmware, "firmware");
    }

    /**
     * Parses an identification reply. Trailing line terminators are ignored.
     *
     * @throws InstrumentHandshakeException if the reply does not have four fields
     */
    public static InstrumentIdentity parse(String reply) throws InstrumentHandshakeException {
        Objects.requireNonNull(reply, "reply");
        String[] fields = reply.strip().split(",", -1);
        if (fields.length != 4) {
            throw new InstrumentHandshakeException("Malformed identification reply: '" + reply.strip() + "'");
        }
        return new InstrumentIdentity(fields[0].strip(), fields[1].strip(), fields[2].strip(), fields[3].strip());
    }

    @Override
    public String toString() {
        return manufacturer + " " + model + " (s/n " + serial + ", fw " + firmware + ")";
    }
}
