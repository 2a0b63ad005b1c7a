package com.questrail.instrument.api;

/**
 * Receives values published to a {@link DataChannel}.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface ChannelSubscriber<T>
{
    void dataAdded(T value);
}
