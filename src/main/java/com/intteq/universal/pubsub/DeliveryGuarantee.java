package com.intteq.universal.pubsub;

/**
 * Delivery guarantee offered by a topic.
 */
public enum DeliveryGuarantee {

    /**
     * Every message is delivered to each subscription at least once. Handlers must
     * be idempotent since a message may be delivered more than once.
     */
    AT_LEAST_ONCE
}
