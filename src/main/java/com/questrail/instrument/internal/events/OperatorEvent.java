package com.questrail.instrument.internal.events;

import java.util.Objects;

/**
 * OperatorEvent
 * -----------------------------------------------------------------------------
 * Message carried from a worker execution context to the controller dispatch
 * loop. Every event is stamped with the activation cycle it belongs to so the
 * receiving runtime can drop anything left over from an earlier cycle.
 *
 * <p>For one cycle the worker posts at most one {@link Ready}, never after a
 * {@link Failed} carrying a {@link ErrorKind#PREPARE_FAULT}, and any number of
 * {@link Failed} events raised through {@code reportError}.</p>
 *
 * @param <R> value {@code prepare} hands back
 */
public sealed interface OperatorEvent<R> permits OperatorEvent.Ready, OperatorEvent.Failed
{
    long cycle();

    /** {@code prepare} returned normally. {@code result} may be {@code null}. */
    record Ready<R>(long cycle, R result) implements OperatorEvent<R> {}

    /** Something went wrong on the worker. */
    record Failed<R>(long cycle, ErrorEvent error) implements OperatorEvent<R> {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
