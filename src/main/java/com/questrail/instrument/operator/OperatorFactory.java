package com.questrail.instrument.operator;

/**
 * Creates the operator for one activation.
 *
 * <p>Called on the activating thread, before the worker exists. Construction
 * should be cheap; blocking work belongs in {@link Operator#prepare}.</p>
 */
@FunctionalInterface
public interface OperatorFactory<A, R>
{
    Operator<A, R> create(A args);
}
