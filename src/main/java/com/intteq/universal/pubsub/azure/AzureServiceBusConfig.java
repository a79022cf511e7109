package com.intteq.universal.pubsub.azure;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.ServiceBusProcessorClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClientBuilder;
import com.intteq.universal.pubsub.PubSubProperties;
import com.intteq.universal.pubsub.broker.PubSubBroker;
import com.intteq.universal.pubsub.exception.PubSubConfigurationException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Azure Service Bus wiring for the Universal Pub/Sub library.
 *
 * <p>Active when {@code pubsub.provider=azure} and testing mode is off.
 *
 * <p>Authentication:
 * <ul>
 *     <li>{@code pubsub.azure.connection-string}, else</li>
 *     <li>the {@code AZURE_SERVICEBUS_CONNECTION_STRING} environment variable, else</li>
 *     <li>Managed Identity against {@code pubsub.azure.namespace}.</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(ServiceBusProcessorClient.class)
@ConditionalOnExpression("'${pubsub.provider:rabbitmq}'.equalsIgnoreCase('azure') and !${pubsub.testing:false}")
@EnableConfigurationProperties(PubSubProperties.class)
public class AzureServiceBusConfig {

    static final String CONNECTION_STRING_ENV = "AZURE_SERVICEBUS_CONNECTION_STRING";

    // ===========================================================
    // Credential / Connection Resolution
    // ===========================================================

    static String resolveConnectionString(PubSubProperties.Azure azure, String env) {
        if (azure.getConnectionString() != null && !azure.getConnectionString().isBlank()) {
            return azure.getConnectionString();
        }
        if (env != null && !env.isBlank()) {
            return env;
        }
        return null; // indicates fallback to Managed Identity
    }

    private static String requireNamespace(PubSubProperties.Azure azure) {
        if (azure.getNamespace() == null || azure.getNamespace().isBlank()) {
            throw new PubSubConfigurationException(
                    "pubsub.azure.namespace is required when no Service Bus connection string is configured");
        }
        return azure.getNamespace();
    }

    // ===========================================================
    // Bean Definitions
    // ===========================================================

    @Bean
    @ConditionalOnMissingBean
    public ServiceBusClientBuilder serviceBusClientBuilder(PubSubProperties properties) {
        String connectionString = resolveConnectionString(properties.getAzure(), System.getenv(CONNECTION_STRING_ENV));
        if (connectionString == null) {
            log.info("Azure Service Bus client using Managed Identity auth.");
            TokenCredential credential = new DefaultAzureCredentialBuilder().build();
            return new ServiceBusClientBuilder()
                    .fullyQualifiedNamespace(requireNamespace(properties.getAzure()))
                    .credential(credential);
        }
        log.info("Azure Service Bus using connection string authentication.");
        return new ServiceBusClientBuilder().connectionString(connectionString);
    }

    @Bean
    @ConditionalOnMissingBean
    public ServiceBusAdministrationClient serviceBusAdministrationClient(PubSubProperties properties) {
        String connectionString = resolveConnectionString(properties.getAzure(), System.getenv(CONNECTION_STRING_ENV));
        if (connectionString == null) {
            log.info("Azure Service Bus admin client using Managed Identity auth.");
            TokenCredential credential = new DefaultAzureCredentialBuilder().build();
            return new ServiceBusAdministrationClientBuilder()
                    .credential(requireNamespace(properties.getAzure()), credential)
                    .buildClient();
        }
        return new ServiceBusAdministrationClientBuilder()
                .connectionString(connectionString)
                .buildClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public AzureSubscriptionProvisioner azureSubscriptionProvisioner(ServiceBusAdministrationClient admin,
                                                                     ObjectProvider<MeterRegistry> meterRegistry) {
        return new AzureSubscriptionProvisioner(admin, meterRegistry.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean(PubSubBroker.class)
    public AzureServiceBusPubSubBroker azureServiceBusPubSubBroker(ServiceBusClientBuilder clientBuilder,
                                                                   AzureSubscriptionProvisioner provisioner,
                                                                   PubSubProperties properties) {
        return new AzureServiceBusPubSubBroker(clientBuilder, provisioner, properties.getAzure());
    }
}
