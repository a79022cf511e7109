package com.intteq.universal.pubsub.tracing;

/**
 * An open span for one delivery attempt. Must be finished exactly once.
 */
public interface TraceSpan {

    /**
     * @param error the delivery's failure, or {@code null} on success
     */
    void finish(Throwable error);
}
