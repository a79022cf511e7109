package com.intteq.universal.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.intteq.universal.pubsub.azure.AzureServiceBusConfig;
import com.intteq.universal.pubsub.broker.InMemoryPubSubBroker;
import com.intteq.universal.pubsub.broker.PubSubBroker;
import com.intteq.universal.pubsub.codec.JacksonMessageDecoder;
import com.intteq.universal.pubsub.codec.MessageDecoder;
import com.intteq.universal.pubsub.config.StaticSubscriptionConfigResolver;
import com.intteq.universal.pubsub.config.SubscriptionConfigResolver;
import com.intteq.universal.pubsub.internal.SubscriptionListenerProcessor;
import com.intteq.universal.pubsub.rabbitmq.RabbitMQConfig;
import com.intteq.universal.pubsub.registry.SubscriptionRegistry;
import com.intteq.universal.pubsub.tracing.DeliveryTracer;
import com.intteq.universal.pubsub.tracing.ObservationDeliveryTracer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the Universal Pub/Sub library.
 *
 * <p>Enabled by default; disable it with:
 *
 * <pre>
 *   pubsub.enabled = false
 * </pre>
 *
 * <p>The application's {@link ObjectMapper}, {@link MeterRegistry} and
 * {@link ObservationRegistry} are used when present. Without them the library falls
 * back to a default mapper, no metrics and no-op tracing.
 *
 * <p>With {@code pubsub.testing=true} an {@link InMemoryPubSubBroker} replaces the real broker.
 */
@AutoConfiguration(after = {RabbitMQConfig.class, AzureServiceBusConfig.class},
        afterName = "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration")
@EnableConfigurationProperties(PubSubProperties.class)
@ConditionalOnProperty(prefix = "pubsub", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PubSubAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionConfigResolver subscriptionConfigResolver(PubSubProperties properties) {
        return new StaticSubscriptionConfigResolver(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageDecoder messageDecoder(ObjectProvider<ObjectMapper> objectMapper) {
        // If the application does not provide an ObjectMapper, create a default one internally.
        ObjectMapper mapper = objectMapper.getIfAvailable(() -> JsonMapper.builder().findAndAddModules().build());
        return new JacksonMessageDecoder(mapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryTracer deliveryTracer(ObjectProvider<ObservationRegistry> observationRegistry) {
        return new ObservationDeliveryTracer(observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    @ConditionalOnMissingBean(PubSubBroker.class)
    @ConditionalOnProperty(prefix = "pubsub", name = "testing", havingValue = "true")
    public InMemoryPubSubBroker inMemoryPubSubBroker() {
        return new InMemoryPubSubBroker();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionRegistry subscriptionRegistry(SubscriptionConfigResolver resolver,
                                                     PubSubBroker broker,
                                                     MessageDecoder decoder,
                                                     DeliveryTracer tracer,
                                                     ObjectProvider<MeterRegistry> meterRegistry) {
        return new SubscriptionRegistry(resolver, broker, decoder, tracer, meterRegistry.getIfAvailable());
    }

    @Bean
    public SubscriptionListenerProcessor subscriptionListenerProcessor(ApplicationContext context,
                                                                       SubscriptionRegistry registry) {
        return new SubscriptionListenerProcessor(context, registry);
    }
}
