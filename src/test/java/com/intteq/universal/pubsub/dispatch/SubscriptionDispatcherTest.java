package com.intteq.universal.pubsub.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.universal.pubsub.CancellationSignal;
import com.intteq.universal.pubsub.DeliveryContext;
import com.intteq.universal.pubsub.DeliveryGuarantee;
import com.intteq.universal.pubsub.DeliveryOutcome;
import com.intteq.universal.pubsub.Deliveries;
import com.intteq.universal.pubsub.OrderEvent;
import com.intteq.universal.pubsub.OutOfStockException;
import com.intteq.universal.pubsub.SubscriptionHandler;
import com.intteq.universal.pubsub.Topic;
import com.intteq.universal.pubsub.codec.JacksonMessageDecoder;
import com.intteq.universal.pubsub.codec.MessageDecoder;
import com.intteq.universal.pubsub.config.ResolvedSubscription;
import com.intteq.universal.pubsub.exception.InternalDeliveryException;
import com.intteq.universal.pubsub.exception.PubSubException;
import com.intteq.universal.pubsub.tracing.DeliveryTracer;
import com.intteq.universal.pubsub.tracing.ObservationDeliveryTracer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.tck.TestObservationRegistry;
import io.micrometer.observation.tck.TestObservationRegistryAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class SubscriptionDispatcherTest {

    private final Topic<OrderEvent> topic = Topic.create("orders", OrderEvent.class, DeliveryGuarantee.AT_LEAST_ONCE);

    private final ResolvedSubscription descriptor = ResolvedSubscription.builder()
            .service("fulfilment")
            .topic("orders")
            .topicProviderName("orders")
            .subscription("order-events")
            .subscriptionProviderName("order-events")
            .build();

    private TestObservationRegistry observations;
    private SimpleMeterRegistry meters;
    private JacksonMessageDecoder decoder;

    @BeforeEach
    void setUp() {
        observations = TestObservationRegistry.create();
        meters = new SimpleMeterRegistry();
        decoder = new JacksonMessageDecoder(new ObjectMapper());
    }

    @Test
    void successfulHandlerIsAcknowledged() {
        List<OrderEvent> received = new ArrayList<>();
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> received.add(event));

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m1", 1));

        assertThat(outcome.isAcknowledged()).isTrue();
        assertThat(outcome.error()).isEmpty();
        assertThat(received).singleElement().extracting(OrderEvent::getOrderId).isEqualTo("o-1");
        assertThat(meters.counter("pubsub.consume.success", "topic", "orders", "subscription", "order-events").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("pubsub.consume.latency", "topic", "orders", "subscription", "order-events").count())
                .isEqualTo(1L);
    }

    @Test
    void contextCarriesDeliveryMetadata() {
        AtomicReference<DeliveryContext> seen = new AtomicReference<>();
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> seen.set(ctx));
        CancellationSignal.Source cancellation = CancellationSignal.source();

        dispatcher.deliver(cancellation, Deliveries.json("m7", 3, "{\"orderId\":\"o-1\"}", Map.of("tenant", "acme")));
        cancellation.cancel();

        DeliveryContext ctx = seen.get();
        assertThat(ctx.service()).isEqualTo("fulfilment");
        assertThat(ctx.topic()).isEqualTo("orders");
        assertThat(ctx.subscription()).isEqualTo("order-events");
        assertThat(ctx.messageId()).isEqualTo("m7");
        assertThat(ctx.attempt()).isEqualTo(3);
        assertThat(ctx.publishTime()).isEqualTo(Deliveries.PUBLISHED);
        assertThat(ctx.attributes()).containsEntry("tenant", "acme");
        assertThat(ctx.isCancelled()).isTrue();
    }

    @Test
    void spanIsRecordedAroundTheHandler() {
        dispatcher((ctx, event) -> { }).deliver(CancellationSignal.none(), Deliveries.order("m1", 2));

        TestObservationRegistryAssert.assertThat(observations)
                .hasSingleObservationThat()
                .hasNameEqualTo("pubsub.message")
                .hasContextualNameEqualTo("orders order-events process")
                .hasLowCardinalityKeyValue("service", "fulfilment")
                .hasLowCardinalityKeyValue("topic", "orders")
                .hasLowCardinalityKeyValue("subscription", "order-events")
                .hasHighCardinalityKeyValue("message.id", "m1")
                .hasHighCardinalityKeyValue("delivery.attempt", "2")
                .doesNotHaveError()
                .hasBeenStopped();
    }

    @Test
    void businessErrorIsReturnedUnchanged() {
        OutOfStockException failure = new OutOfStockException("insufficient-stock");
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> {
            throw failure;
        });

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m2", 1));

        assertThat(outcome.isAcknowledged()).isFalse();
        assertThat(outcome.error()).containsSame(failure);
        TestObservationRegistryAssert.assertThat(observations)
                .hasSingleObservationThat()
                .hasError()
                .hasBeenStopped();
        assertThat(meters.counter("pubsub.consume.failure",
                "topic", "orders", "subscription", "order-events", "reason", "handler").count()).isEqualTo(1.0);
    }

    @Test
    void libraryExceptionFromHandlerIsReturnedUnchanged() {
        PubSubException failure = new PubSubException("rejected");
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> {
            throw failure;
        });

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m3", 1));

        assertThat(outcome.error()).containsSame(failure);
    }

    @Test
    void unexpectedAbortIsConvertedAndDispatcherKeepsServing(CapturedOutput output) {
        AtomicInteger calls = new AtomicInteger();
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IndexOutOfBoundsException("index out of range");
            }
        });

        DeliveryOutcome first = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m4", 1));
        DeliveryOutcome second = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m5", 1));

        assertThat(first.error()).get()
                .isInstanceOfSatisfying(InternalDeliveryException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(InternalDeliveryException.Reason.HANDLER_PANICKED);
                    assertThat(e.getMessage()).startsWith("subscriber panicked: ").contains("index out of range");
                    assertThat(e.getCause()).isInstanceOf(IndexOutOfBoundsException.class);
                });
        assertThat(second.isAcknowledged()).isTrue();
        assertThat(calls).hasValue(2);
        assertThat(meters.counter("pubsub.consume.failure",
                "topic", "orders", "subscription", "order-events", "reason", "panic").count()).isEqualTo(1.0);
        assertThat(output).containsOnlyOnce(
                "subscriber panicked (topic=orders subscription=order-events msg_id=m4 delivery_attempt=1)");
        assertThat(output).doesNotContain("msg_id=m5");
    }

    @Test
    void errorThrownByHandlerIsConverted() {
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> {
            throw new AssertionError("boom");
        });

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m6", 1));

        assertThat(outcome.error()).get()
                .isInstanceOf(InternalDeliveryException.class)
                .extracting(Throwable::getMessage)
                .asString()
                .contains("boom");
    }

    @Test
    void interruptedHandlerRestoresInterruptFlag() {
        InterruptedException failure = new InterruptedException("shutting down");
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> {
            throw failure;
        });

        try {
            DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m8", 1));

            assertThat(outcome.error()).containsSame(failure);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void undecodablePayloadNeverReachesHandler(CapturedOutput output) {
        AtomicInteger calls = new AtomicInteger();
        SubscriptionDispatcher<OrderEvent> dispatcher = dispatcher((ctx, event) -> calls.incrementAndGet());

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.json("m9", 1, "{not json"));

        assertThat(calls).hasValue(0);
        assertThat(outcome.error()).get()
                .isInstanceOfSatisfying(InternalDeliveryException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(InternalDeliveryException.Reason.DECODE_FAILED);
                    assertThat(e.getMessage()).isEqualTo("failed to unmarshal message");
                });
        TestObservationRegistryAssert.assertThat(observations).doesNotHaveAnyObservation();
        assertThat(meters.counter("pubsub.consume.failure",
                "topic", "orders", "subscription", "order-events", "reason", "decode").count()).isEqualTo(1.0);
        assertThat(output).containsOnlyOnce("failed to unmarshal message (service=fulfilment topic=orders "
                + "subscription=order-events msg_id=m9 delivery_attempt=1)");
    }

    @Test
    void decoderErrorIsReturnedAsOutcome() {
        AtomicInteger calls = new AtomicInteger();
        SubscriptionDispatcher<OrderEvent> dispatcher = new SubscriptionDispatcher<>(
                topic, descriptor, (ctx, event) -> calls.incrementAndGet(),
                new ThrowingDecoder(new AssertionError("decoder bug")),
                new ObservationDeliveryTracer(observations), meters);

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m12", 1));

        assertThat(calls).hasValue(0);
        assertThat(outcome.error()).get()
                .isInstanceOfSatisfying(InternalDeliveryException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(InternalDeliveryException.Reason.DECODE_FAILED);
                    assertThat(e.getCause()).isInstanceOf(AssertionError.class);
                });
        TestObservationRegistryAssert.assertThat(observations).doesNotHaveAnyObservation();
    }

    @Test
    void tracerErrorIsReturnedAsOutcome() {
        DeliveryTracer failing = trace -> {
            throw new NoClassDefFoundError("io/opentelemetry/api/trace/Span");
        };
        SubscriptionDispatcher<OrderEvent> dispatcher = new SubscriptionDispatcher<>(
                topic, descriptor, (ctx, event) -> { }, decoder, failing, meters);

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m13", 1));

        assertThat(outcome.error()).get()
                .isInstanceOfSatisfying(InternalDeliveryException.class, e ->
                        assertThat(e.getReason()).isEqualTo(InternalDeliveryException.Reason.TRACE_BEGIN_FAILED));
    }

    @Test
    void concurrentDeliveriesEachGetAnOutcome() throws Exception {
        int deliveries = 200;
        AtomicInteger started = new AtomicInteger();
        AtomicInteger stopped = new AtomicInteger();
        ObservationRegistry registry = ObservationRegistry.create();
        registry.observationConfig().observationHandler(new ObservationHandler<Observation.Context>() {
            @Override
            public void onStart(Observation.Context context) {
                started.incrementAndGet();
            }

            @Override
            public void onStop(Observation.Context context) {
                stopped.incrementAndGet();
            }

            @Override
            public boolean supportsContext(Observation.Context context) {
                return true;
            }
        });
        SubscriptionDispatcher<OrderEvent> dispatcher = new SubscriptionDispatcher<>(
                topic, descriptor,
                (ctx, event) -> {
                    if (Integer.parseInt(ctx.messageId()) % 2 == 0) {
                        throw new IllegalStateException("abort " + ctx.messageId());
                    }
                },
                decoder, new ObservationDeliveryTracer(registry), meters);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<DeliveryOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < deliveries; i++) {
                String messageId = Integer.toString(i);
                futures.add(executor.submit(() ->
                        dispatcher.deliver(CancellationSignal.none(), Deliveries.order(messageId, 1))));
            }
            int acked = 0;
            int failed = 0;
            for (Future<DeliveryOutcome> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isAcknowledged()) {
                    acked++;
                } else {
                    failed++;
                }
            }

            assertThat(acked).isEqualTo(deliveries / 2);
            assertThat(failed).isEqualTo(deliveries / 2);
        } finally {
            executor.shutdownNow();
        }

        assertThat(started).hasValue(deliveries);
        assertThat(stopped).hasValue(deliveries);
        double successes = meters.counter("pubsub.consume.success",
                "topic", "orders", "subscription", "order-events").count();
        double panics = meters.counter("pubsub.consume.failure",
                "topic", "orders", "subscription", "order-events", "reason", "panic").count();
        assertThat(successes + panics).isEqualTo(deliveries);
        assertThat(panics).isEqualTo(deliveries / 2);
    }

    @Test
    void tracerFailureSkipsHandler() {
        AtomicInteger calls = new AtomicInteger();
        DeliveryTracer failing = trace -> {
            throw new IllegalStateException("tracing backend unavailable");
        };
        SubscriptionDispatcher<OrderEvent> dispatcher = new SubscriptionDispatcher<>(
                topic, descriptor, (ctx, event) -> calls.incrementAndGet(), decoder, failing, meters);

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m10", 1));

        assertThat(calls).hasValue(0);
        assertThat(outcome.error()).get()
                .isInstanceOfSatisfying(InternalDeliveryException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(InternalDeliveryException.Reason.TRACE_BEGIN_FAILED);
                    assertThat(e.getMessage()).isEqualTo("failed to begin request");
                });
    }

    @Test
    void spanFinishFailureDoesNotChangeOutcome() {
        DeliveryTracer tracer = trace -> error -> {
            throw new IllegalStateException("exporter closed");
        };
        SubscriptionDispatcher<OrderEvent> dispatcher = new SubscriptionDispatcher<>(
                topic, descriptor, (ctx, event) -> { }, decoder, tracer, null);

        DeliveryOutcome outcome = dispatcher.deliver(CancellationSignal.none(), Deliveries.order("m11", 1));

        assertThat(outcome.isAcknowledged()).isTrue();
    }

    private static final class ThrowingDecoder implements MessageDecoder {

        private final Error error;

        ThrowingDecoder(Error error) {
            this.error = error;
        }

        @Override
        public <T> T decode(Map<String, String> attributes, byte[] payload, Type messageType) {
            throw error;
        }
    }

    private SubscriptionDispatcher<OrderEvent> dispatcher(SubscriptionHandler<OrderEvent> handler) {
        return new SubscriptionDispatcher<>(
                topic, descriptor, handler, decoder, new ObservationDeliveryTracer(observations), meters);
    }
}
