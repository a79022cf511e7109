package com.intteq.universal.pubsub.tracing;

/**
 * Starts spans correlating delivery attempts with a distributed trace.
 */
public interface DeliveryTracer {

    /**
     * Opens a span for a delivery attempt.
     *
     * @throws RuntimeException if the tracing infrastructure cannot start the span;
     *                          the dispatcher then fails the delivery without calling the handler
     */
    TraceSpan begin(DeliveryTrace trace);
}
