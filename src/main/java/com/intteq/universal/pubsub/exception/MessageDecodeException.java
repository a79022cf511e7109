package com.intteq.universal.pubsub.exception;

/**
 * Exception thrown when a delivered payload or its attributes cannot be decoded
 * into the subscription's message type.
 */
public class MessageDecodeException extends PubSubException {

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public MessageDecodeException(String message) {
        super(message);
    }
}
