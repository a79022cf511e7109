package com.intteq.universal.pubsub.annotation;

import java.lang.annotation.*;

/**
 * Marks a bean whose {@link Subscribe} methods are registered as subscriptions at startup.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @Component
 * @PubSubListener
 * public class FulfilmentListener {
 *
 *     @Subscribe(topic = "orders", name = "order-events", maxRetries = 10)
 *     public void onOrder(DeliveryContext ctx, OrderEvent event) throws OutOfStockException {
 *         // business logic...
 *     }
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface PubSubListener {

    /**
     * Optional human-readable documentation for developers or monitoring systems.
     */
    String description() default "";
}
