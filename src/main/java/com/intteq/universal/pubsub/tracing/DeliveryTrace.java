package com.intteq.universal.pubsub.tracing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Attributes of the span opened for one delivery attempt.
 */
@Value
@Builder
public class DeliveryTrace {

    public static final String OPERATION = "pubsub.message";

    @NonNull
    @Builder.Default
    String operation = OPERATION;

    @NonNull
    String service;

    @NonNull
    String topic;

    @NonNull
    String subscription;

    @NonNull
    String messageId;

    int attempt;

    @NonNull
    Instant publishTime;
}
