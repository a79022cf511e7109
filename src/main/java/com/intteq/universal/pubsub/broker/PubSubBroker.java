package com.intteq.universal.pubsub.broker;

/**
 * Transport that delivers messages to registered subscriptions.
 *
 * <p>The broker owns persistence, routing, acknowledgement and redelivery. It calls the
 * {@link DeliveryCallback} once per delivery attempt and acknowledges the message when
 * the returned outcome is successful; otherwise it redelivers within the bounds of the
 * request's retry policy.
 */
public interface PubSubBroker {

    /**
     * Starts delivering messages of the described subscription to the callback.
     */
    void subscribe(SubscribeRequest request, DeliveryCallback callback);
}
