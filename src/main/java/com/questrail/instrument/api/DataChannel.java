package com.questrail.instrument.api;

/**
 * DataChannel
 * -----------------------------------------------------------------------------
 * Port onto the data-channel transport that devices publish samples to.
 *
 * <p>Buffering, storage and fan-out belong to the transport behind this port.
 * Operators call {@link #addData} from their worker; implementations must
 * accept calls from any thread.</p>
 *
 * @param <T> value type
 */
public interface DataChannel<T>
{
    void addData(T value);

    void subscribe(ChannelSubscriber<? super T> subscriber);

    void unsubscribe(ChannelSubscriber<? super T> subscriber);

    /**
     * Closes the channel. Values added afterwards are the transport's concern.
     */
    void close();
}
