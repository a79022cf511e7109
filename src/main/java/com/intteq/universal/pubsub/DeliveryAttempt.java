package com.intteq.universal.pubsub;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One delivery of one message to one subscription, as reported by the broker.
 *
 * <p>Attempts are numbered from 1. Instances only live for the duration of a single
 * dispatch and are never persisted.
 */
@Getter
@Accessors(fluent = true)
public final class DeliveryAttempt {

    private static final byte[] EMPTY = new byte[0];

    private final String messageId;
    private final Instant publishTime;
    private final int attempt;
    private final Map<String, String> attributes;
    private final byte[] payload;

    @Builder
    private DeliveryAttempt(String messageId,
                            Instant publishTime,
                            int attempt,
                            Map<String, String> attributes,
                            byte[] payload) {
        if (attempt < 1) {
            throw new IllegalArgumentException("delivery attempt is 1-based, got " + attempt);
        }
        this.messageId = Objects.requireNonNull(messageId, "messageId must not be null");
        this.publishTime = Objects.requireNonNull(publishTime, "publishTime must not be null");
        this.attempt = attempt;
        this.attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        this.payload = payload != null ? payload : EMPTY;
    }

    @Override
    public String toString() {
        return "DeliveryAttempt[messageId=" + messageId + ", attempt=" + attempt
                + ", publishTime=" + publishTime + ", payloadBytes=" + payload.length + "]";
    }
}
