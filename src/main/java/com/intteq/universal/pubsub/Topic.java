package com.intteq.universal.pubsub;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * A named channel carrying messages of a single application type.
 *
 * <p>Topics are created once during application bootstrap, usually as Spring beans:
 * <pre>
 * {@code
 * @Bean
 * public Topic<OrderEvent> ordersTopic() {
 *     return Topic.create("orders", OrderEvent.class, DeliveryGuarantee.AT_LEAST_ONCE);
 * }
 * }
 * </pre>
 *
 * <p>Once deployed, never rename a topic: messages in flight under the old name would be lost.
 *
 * @param <T> the message type carried by the topic
 */
@Getter
@Accessors(fluent = true)
public final class Topic<T> {

    private final String name;
    private final Type messageType;
    private final DeliveryGuarantee deliveryGuarantee;

    private Topic(String name, Type messageType, DeliveryGuarantee deliveryGuarantee) {
        ResourceNames.requireValid("topic", name);
        this.name = name;
        this.messageType = Objects.requireNonNull(messageType, "messageType must not be null");
        this.deliveryGuarantee = Objects.requireNonNull(deliveryGuarantee, "deliveryGuarantee must not be null");
    }

    public static <T> Topic<T> create(String name, Class<T> messageType, DeliveryGuarantee deliveryGuarantee) {
        return new Topic<>(name, messageType, deliveryGuarantee);
    }

    /**
     * Creates a topic for a generic message type, e.g. {@code new TypeReference<Envelope<Order>>() {}}.
     */
    public static <T> Topic<T> create(String name, TypeReference<T> messageType, DeliveryGuarantee deliveryGuarantee) {
        Objects.requireNonNull(messageType, "messageType must not be null");
        return new Topic<>(name, messageType.getType(), deliveryGuarantee);
    }

    @Override
    public String toString() {
        return "Topic[" + name + "]";
    }
}
