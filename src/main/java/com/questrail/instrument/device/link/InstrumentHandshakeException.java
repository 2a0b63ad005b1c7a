package com.questrail.instrument.device.link;

/**
 * The instrument could not be reached or did not identify itself.
 */
public class InstrumentHandshakeException extends Exception {

    public InstrumentHandshakeException(String message) {
        super(message);
    }

    public InstrumentHandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
