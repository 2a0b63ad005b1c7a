package com.questrail.instrument.gate;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CompletionGate
 * =============================================================================
 * Process-wide, non-negative reference counter that keeps a measurement run or
 * step from being declared finished while any component still has work
 * outstanding.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #acquire()} increments and always succeeds.</li>
 *   <li>{@link #release()} decrements; releasing at zero throws
 *       {@link GateUnderflowException} and leaves the count at zero.</li>
 *   <li>{@link #count()} is what the run/step controller checks: it may only
 *       finish a run or step after observing zero.</li>
 * </ul>
 *
 * <p>There is no owner tracking and no ordering. Any component may acquire or
 * release from any thread. Updates are lock-free compare-and-set operations on
 * a single {@link AtomicInteger}, so concurrent completions from many workers
 * never lose an update.</p>
 */
public final class CompletionGate {

    private final GateRole role;
    private final AtomicInteger count = new AtomicInteger();
    private final List<GateListener> listeners = new CopyOnWriteArrayList<>();

    public CompletionGate(GateRole role) {
        this.role = Objects.requireNonNull(role, "role");
    }

    public GateRole role() {
        return role;
    }

    public void acquire() {
        int now = count.incrementAndGet();
        if (now == 1) {
            for (GateListener l : listeners) {
                l.gateAcquired(this);
            }
        }
    }

    /**
     * @throws GateUnderflowException if the count is already zero
     */
    public void release() {
        int current;
        do {
            current = count.get();
            if (current == 0) {
                throw new GateUnderflowException(role);
            }
        } while (!count.compareAndSet(current, current - 1));

        if (current == 1) {
            for (GateListener l : listeners) {
                l.gateReleased(this);
            }
        }
    }

    public int count() {
        return count.get();
    }

    public boolean isAcquired() {
        return count.get() > 0;
    }

    public void addListener(GateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(GateListener listener) {
        listeners.remove(listener);
    }

    @Override
    public String toString() {
        return role + "Gate[" + count.get() + "]";
    }
}
