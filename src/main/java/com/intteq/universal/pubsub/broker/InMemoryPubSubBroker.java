package com.intteq.universal.pubsub.broker;

import com.intteq.universal.pubsub.CancellationSignal;
import com.intteq.universal.pubsub.DeliveryAttempt;
import com.intteq.universal.pubsub.DeliveryOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Broker used in testing mode.
 *
 * <p>It performs no network registration. Tests drive deliveries explicitly through
 * {@link #deliver(String, String, DeliveryAttempt)} and inspect the returned outcome.
 */
@Slf4j
public class InMemoryPubSubBroker implements PubSubBroker {

    private final Map<Key, Registration> registrations = new ConcurrentHashMap<>();

    @Override
    public void subscribe(SubscribeRequest request, DeliveryCallback callback) {
        Key key = new Key(request.topic(), request.subscription());
        Registration previous = registrations.putIfAbsent(key, new Registration(request, callback));
        if (previous != null) {
            throw new IllegalStateException("subscription already registered: " + key);
        }
        log.debug("In-memory subscription registered → topic={} subscription={}",
                request.topic(), request.subscription());
    }

    /**
     * Runs one delivery attempt synchronously.
     *
     * @throws IllegalArgumentException if no such subscription was registered
     */
    public DeliveryOutcome deliver(String topic, String subscription, DeliveryAttempt attempt) {
        return deliver(topic, subscription, attempt, CancellationSignal.none());
    }

    public DeliveryOutcome deliver(String topic,
                                   String subscription,
                                   DeliveryAttempt attempt,
                                   CancellationSignal cancellation) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        return registration(topic, subscription).callback().deliver(cancellation, attempt);
    }

    /**
     * The request a subscription was registered with, e.g. to inspect its retry policy.
     */
    public SubscribeRequest request(String topic, String subscription) {
        return registration(topic, subscription).request();
    }

    public boolean isSubscribed(String topic, String subscription) {
        return registrations.containsKey(new Key(topic, subscription));
    }

    public Set<String> subscriptions(String topic) {
        return registrations.keySet().stream()
                .filter(k -> k.topic().equals(topic))
                .map(Key::subscription)
                .collect(Collectors.toUnmodifiableSet());
    }

    private Registration registration(String topic, String subscription) {
        Registration registration = registrations.get(new Key(topic, subscription));
        if (registration == null) {
            throw new IllegalArgumentException("no subscription " + subscription + " on topic " + topic);
        }
        return registration;
    }

    private record Key(String topic, String subscription) {
        @Override
        public String toString() {
            return topic + "/" + subscription;
        }
    }

    private record Registration(SubscribeRequest request, DeliveryCallback callback) {
    }
}
