package com.questrail.instrument.observability;

import com.questrail.instrument.internal.events.ErrorEvent;
import com.questrail.instrument.internal.events.ErrorKind;

import java.time.Instant;

/**
 * An error surfaced somewhere in the runtime.
 *
 * @param source  device name, or the component that caught the error
 * @param fatal   whether the error ended the source's activation
 * @param cause   attached throwable, if any
 */
public record InstrumentErrorEvent(
    Instant timestamp,
    String source,
    ErrorKind kind,
    String message,
    Throwable cause,
    boolean fatal
) {
    /**
     * Builds the observability view of an {@link ErrorEvent} raised for a device.
     */
    public static InstrumentErrorEvent of(String source, ErrorEvent error, boolean fatal) {
        Throwable cause = null;
        if (error instanceof ErrorEvent.Fault f) {
            cause = f.fault();
        }
        else if (error instanceof ErrorEvent.Message m && m.detail() instanceof Throwable t) {
            cause = t;
        }
        return new InstrumentErrorEvent(error.timestamp(), source, error.kind(), error.describe(), cause, fatal);
    }
}
