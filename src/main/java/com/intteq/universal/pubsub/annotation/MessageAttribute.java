package com.intteq.universal.pubsub.annotation;

import java.lang.annotation.*;

/**
 * Binds a field of a message type to a transport attribute instead of the payload body.
 *
 * <p>Example:
 * <pre>
 * {@code
 * public class OrderEvent {
 *
 *     private String orderId;
 *
 *     @MessageAttribute("tenant")
 *     private String tenant;
 * }
 * }
 * </pre>
 *
 * <p>On decode the attribute value is converted to the field's type. A missing
 * attribute leaves the field as decoded from the payload.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessageAttribute {

    /**
     * Attribute name.
     */
    String value();
}
