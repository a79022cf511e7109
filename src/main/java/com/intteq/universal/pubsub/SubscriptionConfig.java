package com.intteq.universal.pubsub;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Declaration of a subscription: the handler and an optional retry policy.
 *
 * <p>A {@code null} retry policy, or any {@code null} field of it, falls back to
 * the {@link RetryPolicy} defaults.
 *
 * @param <T> the topic's message type
 */
@Value
@Builder
public class SubscriptionConfig<T> {

    @NonNull
    SubscriptionHandler<T> handler;

    RetryPolicy retryPolicy;

    public static <T> SubscriptionConfig<T> of(SubscriptionHandler<T> handler) {
        return SubscriptionConfig.<T>builder().handler(handler).build();
    }
}
