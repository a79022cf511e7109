package com.intteq.universal.pubsub;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the Universal Pub/Sub library.
 *
 * <p>Prefix: {@code pubsub.*}
 *
 * <p>Examples:
 * <pre>
 * pubsub.provider=rabbitmq
 *
 * pubsub.topics.orders.provider-name=orders.exchange
 * pubsub.topics.orders.subscriptions.order-events.service=fulfilment
 * pubsub.topics.orders.subscriptions.order-events.provider-name=fulfilment.order-events
 *
 * pubsub.rabbitmq.prefetch=20
 * pubsub.azure.max-concurrent-calls=8
 * </pre>
 *
 * <p>The {@code topics} map is the deployed configuration: a subscription declared in code
 * but missing here fails application startup, unless {@code pubsub.testing=true}.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "pubsub")
public class PubSubProperties {

    /**
     * Testing mode. Subscriptions resolve to stub descriptors, deliveries go through the
     * in-memory broker and registration is not logged.
     */
    private boolean testing = false;

    /**
     * Broker to use outside testing mode.
     *
     * <p>Allowed values:
     * <ul>
     *     <li>{@code rabbitmq}</li>
     *     <li>{@code azure}</li>
     * </ul>
     */
    @NotBlank(message = "pubsub.provider must not be blank")
    @Pattern(regexp = "rabbitmq|azure", flags = Pattern.Flag.CASE_INSENSITIVE,
            message = "pubsub.provider must be one of: rabbitmq, azure")
    private String provider = "rabbitmq";

    /**
     * Deployed topics keyed by logical topic name.
     */
    @Valid
    private Map<String, TopicProperties> topics = new HashMap<>();

    @Valid
    private final RabbitMQ rabbitmq = new RabbitMQ();

    @Valid
    private final Azure azure = new Azure();

    // ========================================================================
    // Topics & subscriptions
    // ========================================================================

    @Getter
    @Setter
    @ToString
    public static class TopicProperties {

        /** Physical exchange (RabbitMQ) or topic (Azure) name. Defaults to the logical name. */
        private String providerName;

        /** Deployed subscriptions keyed by logical subscription name. */
        @Valid
        private Map<String, SubscriptionProperties> subscriptions = new HashMap<>();
    }

    @Getter
    @Setter
    @ToString
    public static class SubscriptionProperties {

        /** Service that owns the subscription (required). */
        @NotBlank(message = "subscription.service must not be blank")
        private String service;

        /** Physical queue (RabbitMQ) or subscription (Azure) name. Defaults to the logical name. */
        private String providerName;
    }

    // ========================================================================
    // Provider settings
    // ========================================================================

    @Getter
    @Setter
    @ToString
    public static class RabbitMQ {

        /** Per-consumer prefetch count. */
        @Min(value = 1, message = "pubsub.rabbitmq.prefetch must be at least 1")
        private int prefetch = 10;

        /** Recovery interval of listener containers in milliseconds. */
        private long recoveryInterval = 3000L;
    }

    @Getter
    @Setter
    @ToString(exclude = "connectionString")
    public static class Azure {

        /**
         * Optional connection string. Falls back to {@code AZURE_SERVICEBUS_CONNECTION_STRING},
         * then to Managed Identity.
         */
        private String connectionString;

        /** Fully qualified namespace, required when using Managed Identity. */
        private String namespace;

        /** Maximum concurrent handler calls per subscription processor. */
        @Min(value = 1, message = "pubsub.azure.max-concurrent-calls must be at least 1")
        private int maxConcurrentCalls = 5;

        /** Create missing topics and subscriptions at registration time. */
        private boolean provisionSubscriptions = true;
    }
}
