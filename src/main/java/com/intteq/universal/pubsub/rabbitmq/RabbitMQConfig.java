package com.intteq.universal.pubsub.rabbitmq;

import com.intteq.universal.pubsub.PubSubProperties;
import com.intteq.universal.pubsub.broker.PubSubBroker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * RabbitMQ wiring for the Universal Pub/Sub library.
 *
 * <p>Active when {@code pubsub.provider=rabbitmq} (the default) and testing mode is off.
 * Connection settings come from the standard {@code spring.rabbitmq.*} properties; SSL is
 * handled by Spring Boot when {@code spring.rabbitmq.ssl.enabled=true}.
 */
@Slf4j
@AutoConfiguration(before = RabbitAutoConfiguration.class)
@ConditionalOnClass(SimpleMessageListenerContainer.class)
@ConditionalOnExpression("'${pubsub.provider:rabbitmq}'.equalsIgnoreCase('rabbitmq') and !${pubsub.testing:false}")
@EnableConfigurationProperties({PubSubProperties.class, RabbitProperties.class})
public class RabbitMQConfig {

    @Bean
    @ConditionalOnMissingBean
    public ConnectionFactory connectionFactory(RabbitProperties rabbitProps) {
        CachingConnectionFactory factory = new CachingConnectionFactory();

        factory.setHost(rabbitProps.determineHost());
        factory.setPort(rabbitProps.determinePort());
        factory.setUsername(rabbitProps.determineUsername());
        factory.setPassword(rabbitProps.determinePassword());
        if (rabbitProps.determineVirtualHost() != null) {
            factory.setVirtualHost(rabbitProps.determineVirtualHost());
        }

        var timeout = rabbitProps.getConnectionTimeout();
        factory.setConnectionTimeout(timeout != null ? (int) timeout.toMillis() : 10000);

        var heartbeat = rabbitProps.getRequestedHeartbeat();
        factory.setRequestedHeartBeat(heartbeat != null ? (int) heartbeat.getSeconds() : 60);

        factory.setCacheMode(CacheMode.CHANNEL);
        factory.setChannelCacheSize(50);
        factory.setChannelCheckoutTimeout(10_000);

        if (Boolean.TRUE.equals(rabbitProps.getSsl().getEnabled())) {
            log.info("RabbitMQ SSL enabled by application properties");
        }

        log.info("RabbitMQ ConnectionFactory initialized: host={} port={}",
                rabbitProps.determineHost(), rabbitProps.determinePort());

        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        return new RabbitAdmin(connectionFactory);
    }

    @Bean
    @ConditionalOnMissingBean(PubSubBroker.class)
    public RabbitPubSubBroker rabbitPubSubBroker(ConnectionFactory connectionFactory,
                                                 AmqpAdmin amqpAdmin,
                                                 PubSubProperties properties) {
        return new RabbitPubSubBroker(connectionFactory, amqpAdmin, properties.getRabbitmq());
    }
}
