package com.intteq.universal.pubsub.exception;

import lombok.Getter;

/**
 * Internal-classified delivery failure returned to the broker.
 *
 * <p>Produced by the dispatch pipeline when the failure did not come from the
 * handler's own business logic: the payload could not be decoded, the trace span
 * could not be started, or the handler aborted unexpectedly.
 */
@Getter
public class InternalDeliveryException extends PubSubException {

    private final Reason reason;

    public InternalDeliveryException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InternalDeliveryException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public enum Reason {
        DECODE_FAILED("decode"),
        TRACE_BEGIN_FAILED("trace"),
        HANDLER_PANICKED("panic");

        private final String tag;

        Reason(String tag) {
            this.tag = tag;
        }

        /** Short value used as a metric tag. */
        public String tag() {
            return tag;
        }
    }
}
