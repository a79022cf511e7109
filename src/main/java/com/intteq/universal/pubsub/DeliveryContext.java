package com.intteq.universal.pubsub;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Per-delivery information available to a {@link SubscriptionHandler}.
 */
@Getter
@Builder
@Accessors(fluent = true)
public final class DeliveryContext {

    @NonNull
    private final String service;
    @NonNull
    private final String topic;
    @NonNull
    private final String subscription;
    @NonNull
    private final String messageId;
    @NonNull
    private final Instant publishTime;
    private final int attempt;
    @NonNull
    private final Map<String, String> attributes;
    @NonNull
    private final CancellationSignal cancellation;

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public Optional<Instant> deadline() {
        return cancellation.deadline();
    }
}
