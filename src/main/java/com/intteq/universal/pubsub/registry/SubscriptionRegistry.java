package com.intteq.universal.pubsub.registry;

import com.intteq.universal.pubsub.ResourceNames;
import com.intteq.universal.pubsub.RetryPolicy;
import com.intteq.universal.pubsub.Subscription;
import com.intteq.universal.pubsub.SubscriptionConfig;
import com.intteq.universal.pubsub.Topic;
import com.intteq.universal.pubsub.broker.PubSubBroker;
import com.intteq.universal.pubsub.broker.SubscribeRequest;
import com.intteq.universal.pubsub.codec.MessageDecoder;
import com.intteq.universal.pubsub.config.ResolvedSubscription;
import com.intteq.universal.pubsub.config.SubscriptionConfigResolver;
import com.intteq.universal.pubsub.dispatch.SubscriptionDispatcher;
import com.intteq.universal.pubsub.exception.PubSubConfigurationException;
import com.intteq.universal.pubsub.tracing.DeliveryTracer;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the subscriptions of one application.
 *
 * <p>Subscriptions are registered once, during bootstrap, before any traffic is served:
 * <pre>
 * {@code
 * Subscription<OrderEvent> sub = registry.register(ordersTopic, "order-events",
 *         SubscriptionConfig.<OrderEvent>builder()
 *                 .handler((ctx, event) -> fulfilment.process(event))
 *                 .retryPolicy(RetryPolicy.builder().maxRetries(10).build())
 *                 .build());
 * }
 * </pre>
 *
 * <p>Every configuration problem (invalid name, negative backoff, duplicate or unknown
 * subscription) is raised as a {@link PubSubConfigurationException} from {@link #register},
 * leaving the caller's startup sequence to decide how to shut down.
 */
@Slf4j
@RequiredArgsConstructor
public class SubscriptionRegistry {

    private final SubscriptionConfigResolver resolver;
    private final PubSubBroker broker;
    private final MessageDecoder decoder;
    private final DeliveryTracer tracer;

    /** Delivery metrics are skipped when absent. */
    @Nullable
    private final MeterRegistry meterRegistry;

    private final Map<Key, Subscription<?>> subscriptions = new ConcurrentHashMap<>();

    /**
     * Validates and registers a subscription, then starts delivering through the broker.
     *
     * @throws PubSubConfigurationException if the subscription is invalid or unknown to the deployed configuration
     */
    public <T> Subscription<T> register(Topic<T> topic, String name, SubscriptionConfig<T> config) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(config, "config must not be null");

        ResourceNames.requireValid("subscription", name);
        RetryPolicy retryPolicy = RetryPolicy.resolve(config.getRetryPolicy());
        ResolvedSubscription descriptor = resolver.resolve(topic.name(), name);

        Subscription<T> subscription = new Subscription<>(topic, name, retryPolicy, descriptor);
        Key key = new Key(topic.name(), name);
        if (subscriptions.putIfAbsent(key, subscription) != null) {
            throw new PubSubConfigurationException(
                    String.format("subscription %s is already registered on topic %s", name, topic.name()));
        }

        SubscriptionDispatcher<T> dispatcher = new SubscriptionDispatcher<>(
                topic, descriptor, config.getHandler(), decoder, tracer, meterRegistry);
        try {
            broker.subscribe(new SubscribeRequest(descriptor, retryPolicy), dispatcher);
        } catch (RuntimeException e) {
            subscriptions.remove(key);
            throw e;
        }

        if (!resolver.isTesting()) {
            log.info("registered subscription (service={} topic={} subscription={} maxRetries={})",
                    descriptor.getService(), topic.name(), name, retryPolicy.getMaxRetries());
        }

        return subscription;
    }

    public Optional<Subscription<?>> find(String topic, String name) {
        return Optional.ofNullable(subscriptions.get(new Key(topic, name)));
    }

    public Collection<Subscription<?>> subscriptions() {
        return List.copyOf(subscriptions.values());
    }

    private record Key(String topic, String subscription) {
    }
}
