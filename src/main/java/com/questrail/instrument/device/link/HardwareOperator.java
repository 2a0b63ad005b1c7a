package com.questrail.instrument.device.link;

import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.operator.OperatorContext;

/**
 * HardwareOperator
 * -----------------------------------------------------------------------------
 * Template for operators that own a hardware connection.
 *
 * <p>{@code prepare} connects, then runs the handshake. Both steps may block
 * for as long as the hardware needs. If either fails the connection is closed
 * before the failure propagates, since an operator that never became ready is
 * not torn down. {@code teardown} disconnects.</p>
 */
public abstract class HardwareOperator<A, R> implements Operator<A, R> {

    private volatile OperatorContext context;

    @Override
    public final R prepare(OperatorContext context, A args) throws Exception {
        this.context = context;
        try {
            connect(args);
            return handshake(args);
        } catch (Exception e) {
            try {
                disconnect();
            } catch (Exception closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @Override
    public final void teardown() throws Exception {
        disconnect();
    }

    protected OperatorContext context() {
        return context;
    }

    /** Opens the connection. */
    protected abstract void connect(A args) throws Exception;

    /** Talks to the device until it is configured; returns the ready value. */
    protected abstract R handshake(A args) throws Exception;

    /** Closes the connection. Must tolerate a connection that never opened. */
    protected abstract void disconnect() throws Exception;
}
