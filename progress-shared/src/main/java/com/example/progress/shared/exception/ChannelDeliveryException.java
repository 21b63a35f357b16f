package com.example.progress.shared.exception;

/**
 * A frame could not be handed to a client channel, usually because the client has gone away.
 */
public class ChannelDeliveryException extends RuntimeException {

    public ChannelDeliveryException(String message) {
        super(message);
    }

    public ChannelDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
