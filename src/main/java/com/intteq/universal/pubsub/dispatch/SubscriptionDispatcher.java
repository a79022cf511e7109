package com.intteq.universal.pubsub.dispatch;

import com.intteq.universal.pubsub.CancellationSignal;
import com.intteq.universal.pubsub.DeliveryAttempt;
import com.intteq.universal.pubsub.DeliveryContext;
import com.intteq.universal.pubsub.DeliveryOutcome;
import com.intteq.universal.pubsub.SubscriptionHandler;
import com.intteq.universal.pubsub.Topic;
import com.intteq.universal.pubsub.broker.DeliveryCallback;
import com.intteq.universal.pubsub.codec.MessageDecoder;
import com.intteq.universal.pubsub.config.ResolvedSubscription;
import com.intteq.universal.pubsub.exception.InternalDeliveryException;
import com.intteq.universal.pubsub.exception.PubSubException;
import com.intteq.universal.pubsub.tracing.DeliveryTrace;
import com.intteq.universal.pubsub.tracing.DeliveryTracer;
import com.intteq.universal.pubsub.tracing.TraceSpan;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one delivery attempt for one subscription.
 *
 * <p>Each attempt goes through:
 * <ol>
 *     <li>decoding the envelope into the topic's message type,</li>
 *     <li>opening a trace span,</li>
 *     <li>invoking the handler inside the abort boundary,</li>
 *     <li>finishing the span with the result,</li>
 *     <li>returning the outcome to the broker.</li>
 * </ol>
 *
 * <p>A decode failure stops before the span is opened: no span is recorded for payloads
 * that never reached the handler. Nothing thrown by the decoder, the tracer or the handler
 * escapes {@link #deliver}. Instances hold only immutable configuration and may be
 * invoked concurrently.
 *
 * @param <T> the topic's message type
 */
@Slf4j
public class SubscriptionDispatcher<T> implements DeliveryCallback {

    private final Topic<T> topic;
    private final ResolvedSubscription descriptor;
    private final SubscriptionHandler<T> handler;
    private final MessageDecoder decoder;
    private final DeliveryTracer tracer;

    @Nullable
    private final MeterRegistry meterRegistry;

    public SubscriptionDispatcher(Topic<T> topic,
                                  ResolvedSubscription descriptor,
                                  SubscriptionHandler<T> handler,
                                  MessageDecoder decoder,
                                  DeliveryTracer tracer,
                                  @Nullable MeterRegistry meterRegistry) {
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.meterRegistry = meterRegistry;
    }

    @Override
    public DeliveryOutcome deliver(CancellationSignal cancellation, DeliveryAttempt attempt) {
        T message;
        try {
            message = decoder.decode(attempt.attributes(), attempt.payload(), topic.messageType());
        } catch (Throwable e) {
            log.error("failed to unmarshal message (service={} topic={} subscription={} msg_id={} delivery_attempt={})",
                    descriptor.getService(), topic.name(), descriptor.getSubscription(),
                    attempt.messageId(), attempt.attempt(), e);
            recordFailure(InternalDeliveryException.Reason.DECODE_FAILED.tag());
            return DeliveryOutcome.failure(new InternalDeliveryException(
                    InternalDeliveryException.Reason.DECODE_FAILED, "failed to unmarshal message", e));
        }

        TraceSpan span;
        try {
            span = tracer.begin(DeliveryTrace.builder()
                    .service(descriptor.getService())
                    .topic(topic.name())
                    .subscription(descriptor.getSubscription())
                    .messageId(attempt.messageId())
                    .attempt(attempt.attempt())
                    .publishTime(attempt.publishTime())
                    .build());
        } catch (Throwable e) {
            log.error("failed to begin request (topic={} subscription={} msg_id={})",
                    topic.name(), descriptor.getSubscription(), attempt.messageId(), e);
            recordFailure(InternalDeliveryException.Reason.TRACE_BEGIN_FAILED.tag());
            return DeliveryOutcome.failure(new InternalDeliveryException(
                    InternalDeliveryException.Reason.TRACE_BEGIN_FAILED, "failed to begin request", e));
        }

        Exception error = null;
        try {
            long start = System.nanoTime();
            error = invokeHandler(context(cancellation, attempt), message);
            long duration = System.nanoTime() - start;

            if (error == null) {
                recordSuccess(duration);
            } else {
                recordFailure(error instanceof InternalDeliveryException internal
                        ? internal.getReason().tag()
                        : "handler");
            }
        } finally {
            finish(span, error, attempt);
        }

        return error == null ? DeliveryOutcome.success() : DeliveryOutcome.failure(error);
    }

    /**
     * Calls the handler and converts whatever it throws into a returned error.
     *
     * @return {@code null} on success, the handler's own exception for a business failure,
     *         or an internal error for an unexpected abort
     */
    private Exception invokeHandler(DeliveryContext context, T message) {
        try {
            handler.handle(context, message);
            return null;
        } catch (PubSubException e) {
            return e;
        } catch (RuntimeException e) {
            return panicked(context, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        } catch (Exception e) {
            return e;
        } catch (Throwable t) {
            return panicked(context, t);
        }
    }

    private InternalDeliveryException panicked(DeliveryContext context, Throwable abort) {
        log.error("subscriber panicked (topic={} subscription={} msg_id={} delivery_attempt={})",
                context.topic(), context.subscription(), context.messageId(), context.attempt(), abort);
        return new InternalDeliveryException(
                InternalDeliveryException.Reason.HANDLER_PANICKED, "subscriber panicked: " + abort, abort);
    }

    private void finish(TraceSpan span, Exception error, DeliveryAttempt attempt) {
        try {
            span.finish(error);
        } catch (RuntimeException e) {
            log.warn("failed to finish request span (topic={} subscription={} msg_id={})",
                    topic.name(), descriptor.getSubscription(), attempt.messageId(), e);
        }
    }

    private DeliveryContext context(CancellationSignal cancellation, DeliveryAttempt attempt) {
        return DeliveryContext.builder()
                .service(descriptor.getService())
                .topic(topic.name())
                .subscription(descriptor.getSubscription())
                .messageId(attempt.messageId())
                .publishTime(attempt.publishTime())
                .attempt(attempt.attempt())
                .attributes(attempt.attributes())
                .cancellation(cancellation != null ? cancellation : CancellationSignal.none())
                .build();
    }

    // ========================================================================
    //   METRICS
    // ========================================================================

    private void recordSuccess(long durationNs) {
        if (meterRegistry == null) return;

        meterRegistry.timer("pubsub.consume.latency",
                        "topic", topic.name(), "subscription", descriptor.getSubscription())
                .record(durationNs, TimeUnit.NANOSECONDS);

        meterRegistry.counter("pubsub.consume.success",
                        "topic", topic.name(), "subscription", descriptor.getSubscription())
                .increment();
    }

    private void recordFailure(String reason) {
        if (meterRegistry == null) return;

        meterRegistry.counter("pubsub.consume.failure",
                        "topic", topic.name(), "subscription", descriptor.getSubscription(), "reason", reason)
                .increment();
    }
}
