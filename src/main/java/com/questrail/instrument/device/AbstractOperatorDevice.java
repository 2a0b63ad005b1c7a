package com.questrail.instrument.device;

import com.questrail.instrument.api.Device;
import com.questrail.instrument.api.DeviceErrorSurface;
import com.questrail.instrument.api.OperatorHost;
import com.questrail.instrument.operator.Operator;
import com.questrail.instrument.runtime.InstrumentRuntime;
import com.questrail.instrument.runtime.OperatorRuntime;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AbstractOperatorDevice
 * =============================================================================
 * Base for devices whose blocking work lives in an {@link Operator}.
 *
 * <h2>Composition</h2>
 * <p>The device holds an {@link OperatorRuntime} and acts as its
 * {@link OperatorHost}. Subclasses decide what operator to build
 * ({@link #createOperator}) and what to do once it is ready
 * ({@link #operatorReady}).</p>
 *
 * <h2>Errors</h2>
 * <p>Errors are forwarded to the {@link DeviceErrorSurface} the device was
 * created with, typically a UI panel or a log.</p>
 *
 * <h2>Registry</h2>
 * <p>A device joins the {@link DeviceRegistry} on its first activation, once
 * it is fully constructed, and leaves it when killed.</p>
 *
 * <h2>Kill</h2>
 * <p>{@link #kill()} deactivates the runtime, waiting for the operator's
 * worker, then drops the device from the registry and runs
 * {@link #onKilled()}. A fatal initialization error arrives through
 * {@link #terminate()} on the controller dispatch thread; the runtime has
 * already told the operator to stop, so the device is dropped without waiting
 * for the worker. {@link #onKilled()} runs at most once either way.</p>
 *
 * @param <A> operator arguments
 * @param <R> value {@code prepare} hands back
 */
public abstract class AbstractOperatorDevice<A, R> implements Device, OperatorHost<R> {

    private final String name;
    private final InstrumentRuntime runtime;
    private final DeviceRegistry registry;
    private final DeviceErrorSurface errorSurface;
    private final OperatorRuntime<A, R> operatorRuntime;
    private final AtomicBoolean killed = new AtomicBoolean(false);

    protected AbstractOperatorDevice(String name, InstrumentRuntime runtime, DeviceErrorSurface errorSurface) {
        this.name = Objects.requireNonNull(name, "name");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.registry = runtime.registry();
        this.errorSurface = Objects.requireNonNull(errorSurface, "errorSurface");
        this.operatorRuntime = runtime.newOperatorRuntime(name, this);
    }

    /**
     * Builds the operator for one activation. Called on the activating thread.
     */
    protected abstract Operator<A, R> createOperator(A args);

    /**
     * Starts the operator with {@code args}; readiness arrives later through
     * {@link #operatorReady}.
     *
     * @throws IllegalStateException if the device has been killed, or another
     *                               device already uses its name
     */
    public void activate(A args) {
        if (killed.get()) {
            throw new IllegalStateException("Device " + name + " has been killed");
        }
        registry.register(this);
        operatorRuntime.activate(this::createOperator, args);
    }

    /**
     * Stops the operator and waits for it. The device stays registered and may
     * be activated again.
     */
    public void deactivate() {
        operatorRuntime.deactivate();
    }

    /**
     * Runs {@code task} on the operator's worker.
     */
    protected boolean submitToOperator(Runnable task) {
        return operatorRuntime.submit(task);
    }

    protected InstrumentRuntime runtime() {
        return runtime;
    }

    protected OperatorRuntime<A, R> operatorRuntime() {
        return operatorRuntime;
    }

    /**
     * Whether the current activation has delivered readiness and is still live.
     */
    public boolean isReady() {
        return operatorRuntime.isActive() && operatorRuntime.preparedCompleted();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public final void kill() {
        boolean first = killed.compareAndSet(false, true);
        try {
            operatorRuntime.deactivate();
        } finally {
            if (first) {
                release();
            }
        }
    }

    @Override
    public boolean isKilled() {
        return killed.get();
    }

    @Override
    public void terminate() {
        if (killed.compareAndSet(false, true)) {
            release();
        }
    }

    /**
     * Hook run once when the device is killed. After {@link #kill()} the
     * operator is gone; after a fatal error it has been told to stop.
     */
    protected void onKilled() {
    }

    private void release() {
        registry.unregister(this);
        onKilled();
    }

    @Override
    public void showError(String message, Object detail) {
        errorSurface.showError(message, detail);
    }

    @Override
    public void showException(Throwable fault) {
        errorSurface.showException(fault);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
