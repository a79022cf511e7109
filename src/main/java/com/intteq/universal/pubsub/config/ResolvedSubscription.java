package com.intteq.universal.pubsub.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Deploy-time descriptor of a subscription, resolved from static configuration.
 *
 * <p>Logical names are the ones used in code; provider names are the physical
 * exchange/queue or topic/subscription names on the broker.
 */
@Value
@Builder
public class ResolvedSubscription {

    /** Service owning the subscription, used in logs and trace spans. */
    @NonNull
    String service;

    @NonNull
    String topic;

    @NonNull
    String topicProviderName;

    @NonNull
    String subscription;

    @NonNull
    String subscriptionProviderName;
}
