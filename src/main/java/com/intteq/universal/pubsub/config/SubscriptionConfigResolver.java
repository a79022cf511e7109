package com.intteq.universal.pubsub.config;

/**
 * Maps a logical (topic, subscription) pair to its deploy-time descriptor.
 */
public interface SubscriptionConfigResolver {

    /**
     * @throws com.intteq.universal.pubsub.exception.PubSubConfigurationException
     *         if the pair is not part of the deployed configuration
     */
    ResolvedSubscription resolve(String topic, String subscription);

    /**
     * Whether the resolver runs in testing mode, in which every pair resolves to a
     * stub descriptor and no real broker registration takes place.
     */
    boolean isTesting();
}
