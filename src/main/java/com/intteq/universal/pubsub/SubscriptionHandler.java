package com.intteq.universal.pubsub;

/**
 * Application callback invoked once per delivery attempt.
 *
 * <p>Returning normally acknowledges the message. Throwing a checked exception or a
 * {@link com.intteq.universal.pubsub.exception.PubSubException} reports a business
 * failure; it is handed to the broker unchanged and the message is redelivered
 * according to the subscription's {@link RetryPolicy}. Any other throwable is treated
 * as an unexpected abort and reported as an internal error.
 *
 * @param <T> the topic's message type
 */
@FunctionalInterface
public interface SubscriptionHandler<T> {

    void handle(DeliveryContext context, T message) throws Exception;
}
