package com.intteq.universal.pubsub.annotation;

import java.lang.annotation.*;

/**
 * Declares a method of a {@link PubSubListener} bean as the handler of a subscription.
 *
 * <p>Supported signatures:
 * <ul>
 *   <li>{@code (Payload)}</li>
 *   <li>{@code (DeliveryContext, Payload)}</li>
 * </ul>
 * The payload parameter must accept the message type of the topic, which is looked up
 * among the application's {@code Topic} beans by name.
 *
 * <p>Retry attributes left at their defaults fall back to the
 * {@link com.intteq.universal.pubsub.RetryPolicy} defaults.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Subscribe {

    /**
     * Name of the topic to subscribe to.
     */
    String topic();

    /**
     * Subscription name, unique within the topic. Kebab-case, at most 63 characters.
     */
    String name();

    /**
     * Maximum number of redeliveries. Negative means "use the default".
     */
    int maxRetries() default -1;

    /**
     * Minimum redelivery backoff, e.g. {@code "10s"} or {@code "PT10S"}. Empty means "use the default".
     */
    String minBackoff() default "";

    /**
     * Maximum redelivery backoff, e.g. {@code "10m"}. Empty means "use the default".
     */
    String maxBackoff() default "";
}
