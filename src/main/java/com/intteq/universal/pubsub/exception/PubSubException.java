package com.intteq.universal.pubsub.exception;

/**
 * Base type for every error raised by the pub/sub library itself.
 *
 * <p>Handlers may also throw subclasses of this type to report a business failure;
 * those are returned to the broker unchanged.
 */
public class PubSubException extends RuntimeException {

    public PubSubException(String message) {
        super(message);
    }

    public PubSubException(String message, Throwable cause) {
        super(message, cause);
    }
}
