package com.intteq.universal.pubsub;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one dispatch, used by the broker to acknowledge or redeliver the message.
 *
 * <p>A successful outcome means the message must be acknowledged. A failed outcome
 * carries the error and leaves redelivery to the broker's retry policy.
 */
public final class DeliveryOutcome {

    private static final DeliveryOutcome SUCCESS = new DeliveryOutcome(null);

    private final Exception error;

    private DeliveryOutcome(Exception error) {
        this.error = error;
    }

    public static DeliveryOutcome success() {
        return SUCCESS;
    }

    public static DeliveryOutcome failure(Exception error) {
        return new DeliveryOutcome(Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isAcknowledged() {
        return error == null;
    }

    public Optional<Exception> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return error == null ? "DeliveryOutcome[ack]" : "DeliveryOutcome[nack: " + error + "]";
    }
}
