package com.questrail.instrument.internal.events;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ErrorEvent
 * -----------------------------------------------------------------------------
 * Inert description of a failure produced on a worker execution context and
 * consumed once by the device that owns the originating runtime.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Message}: human-readable text with an optional detail payload,
 *       surfaced through {@code showError(message, detail)}</li>
 *   <li>{@link Fault}: a wrapped {@link Throwable}, surfaced through
 *       {@code showException(fault)}</li>
 * </ul>
 */
public sealed interface ErrorEvent permits ErrorEvent.Message, ErrorEvent.Fault
{
    ErrorKind kind();

    Instant timestamp();

    /** Text suitable for a log line or an error dialog title. */
    String describe();

    static Message message(ErrorKind kind, String message, Object detail, Instant timestamp) {
        return new Message(kind, message, detail, timestamp);
    }

    static Fault fault(ErrorKind kind, Throwable fault, Instant timestamp) {
        return new Fault(kind, fault, timestamp);
    }

    /**
     * Structured error. {@code detail} may be {@code null}; it is typically a
     * string or a throwable giving more context.
     */
    record Message(ErrorKind kind, String message, Object detail, Instant timestamp) implements ErrorEvent {
        public Message {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        public Optional<Object> detailIfPresent() {
            return Optional.ofNullable(detail);
        }

        @Override
        public String describe() {
            return message;
        }
    }

    /**
     * Wrapped fault.
     */
    record Fault(ErrorKind kind, Throwable fault, Instant timestamp) implements ErrorEvent {
        public Fault {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(fault, "fault");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public String describe() {
            String text = fault.getMessage();
            return text != null ? text : fault.getClass().getName();
        }
    }
}
