package com.intteq.universal.pubsub.config;

import com.intteq.universal.pubsub.PubSubProperties;
import com.intteq.universal.pubsub.exception.PubSubConfigurationException;
import lombok.RequiredArgsConstructor;

/**
 * Resolves subscriptions from {@code pubsub.topics.*} in {@link PubSubProperties}.
 *
 * <p>With {@code pubsub.testing=true} every pair resolves to a stub descriptor owned by
 * the service {@value #TEST_SERVICE}.
 */
@RequiredArgsConstructor
public class StaticSubscriptionConfigResolver implements SubscriptionConfigResolver {

    public static final String TEST_SERVICE = "test";

    private final PubSubProperties properties;

    @Override
    public ResolvedSubscription resolve(String topic, String subscription) {
        if (properties.isTesting()) {
            return ResolvedSubscription.builder()
                    .service(TEST_SERVICE)
                    .topic(topic)
                    .topicProviderName(topic)
                    .subscription(subscription)
                    .subscriptionProviderName(subscription)
                    .build();
        }

        PubSubProperties.TopicProperties topicProps = properties.getTopics().get(topic);
        if (topicProps == null) {
            throw unknown(topic, subscription);
        }

        PubSubProperties.SubscriptionProperties subProps = topicProps.getSubscriptions().get(subscription);
        if (subProps == null) {
            throw unknown(topic, subscription);
        }
        if (subProps.getService() == null || subProps.getService().isBlank()) {
            throw new PubSubConfigurationException(
                    String.format("subscription %s on topic %s has no owning service configured", subscription, topic));
        }

        return ResolvedSubscription.builder()
                .service(subProps.getService())
                .topic(topic)
                .topicProviderName(orDefault(topicProps.getProviderName(), topic))
                .subscription(subscription)
                .subscriptionProviderName(orDefault(subProps.getProviderName(), subscription))
                .build();
    }

    @Override
    public boolean isTesting() {
        return properties.isTesting();
    }

    private static PubSubConfigurationException unknown(String topic, String subscription) {
        return new PubSubConfigurationException(
                String.format("unregistered/unknown subscription on topic %s: %s", topic, subscription));
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
