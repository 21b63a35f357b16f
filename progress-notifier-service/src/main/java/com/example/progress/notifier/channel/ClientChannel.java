package com.example.progress.notifier.channel;

import com.example.progress.shared.exception.ChannelDeliveryException;

/**
 * Outbound half of one client's bidirectional message channel.
 * Implementations must not interleave or reorder frames passed to {@link #send}.
 */
public interface ClientChannel {

    /**
     * Queue one text frame for the client.
     *
     * @throws ChannelDeliveryException if the channel is closed or broken
     */
    void send(String frame);

    /** Stop accepting frames and let the transport finish. Safe to call more than once. */
    void close();

    boolean isOpen();
}
