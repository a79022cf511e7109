package com.intteq.universal.pubsub.tracing;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;

/**
 * {@link DeliveryTracer} backed by Micrometer Observation.
 *
 * <p>Each delivery becomes an {@link Observation} named {@value DeliveryTrace#OPERATION}. When
 * the calling thread already runs inside an observation (for instance a test driving the
 * in-memory broker), the span becomes its child instead of starting a new trace.
 */
@RequiredArgsConstructor
public class ObservationDeliveryTracer implements DeliveryTracer {

    private final ObservationRegistry registry;

    @Override
    public TraceSpan begin(DeliveryTrace trace) {
        Observation observation = Observation.createNotStarted(trace.getOperation(), registry)
                .contextualName(trace.getTopic() + " " + trace.getSubscription() + " process")
                .lowCardinalityKeyValue("service", trace.getService())
                .lowCardinalityKeyValue("topic", trace.getTopic())
                .lowCardinalityKeyValue("subscription", trace.getSubscription())
                .highCardinalityKeyValue("message.id", trace.getMessageId())
                .highCardinalityKeyValue("delivery.attempt", Integer.toString(trace.getAttempt()))
                .highCardinalityKeyValue("publish.time", trace.getPublishTime().toString())
                .start();

        Observation.Scope scope;
        try {
            scope = observation.openScope();
        } catch (RuntimeException e) {
            observation.error(e);
            observation.stop();
            throw e;
        }

        return error -> {
            try {
                scope.close();
                if (error != null) {
                    observation.error(error);
                }
            } finally {
                observation.stop();
            }
        };
    }
}
