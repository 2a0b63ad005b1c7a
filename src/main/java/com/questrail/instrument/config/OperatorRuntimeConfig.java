package com.questrail.instrument.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * OperatorRuntimeConfig
 * -----------------------------------------------------------------------------
 * Operational settings shared by every operator runtime of one
 * {@code InstrumentRuntime}.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>dispatchQueueCapacity</b>: bound of the channel from workers to the
 *       controller dispatch loop. When it is full, the posting worker waits;
 *       the controller never does.</li>
 *   <li><b>deactivateTimeout</b>: how long {@code deactivate()} waits for a
 *       worker to exit. Empty means wait for as long as {@code teardown} takes.
 *       When set and exceeded, the device gets a {@code DEACTIVATE_TIMEOUT}
 *       error and the worker is abandoned.</li>
 *   <li><b>workerThreadPrefix</b>: worker threads are named
 *       {@code prefix + deviceName}.</li>
 * </ul>
 */
public record OperatorRuntimeConfig(
        int dispatchQueueCapacity,
        Optional<Duration> deactivateTimeout,
        String workerThreadPrefix
) {
    public OperatorRuntimeConfig {
        Objects.requireNonNull(deactivateTimeout, "deactivateTimeout");
        Objects.requireNonNull(workerThreadPrefix, "workerThreadPrefix");

        if (dispatchQueueCapacity < 1) {
            throw new IllegalArgumentException("dispatchQueueCapacity must be >= 1");
        }
        deactivateTimeout.ifPresent(t -> {
            if (t.isNegative() || t.isZero()) {
                throw new IllegalArgumentException("deactivateTimeout must be positive");
            }
        });
    }

    /**
     * Capacity 1024, unbounded deactivation wait, worker prefix {@code "operator-"}.
     */
    public static OperatorRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int dispatchQueueCapacity = 1024;
        private Duration deactivateTimeout;
        private String workerThreadPrefix = "operator-";

        public Builder withDispatchQueueCapacity(int capacity) {
            this.dispatchQueueCapacity = capacity;
            return this;
        }

        public Builder withDeactivateTimeout(Duration timeout) {
            this.deactivateTimeout = timeout;
            return this;
        }

        public Builder withWorkerThreadPrefix(String prefix) {
            this.workerThreadPrefix = prefix;
            return this;
        }

        public OperatorRuntimeConfig build() {
            return new OperatorRuntimeConfig(
                    dispatchQueueCapacity,
                    Optional.ofNullable(deactivateTimeout),
                    workerThreadPrefix);
        }
    }
}
