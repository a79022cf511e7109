package com.intteq.universal.pubsub.rabbitmq;

import com.intteq.universal.pubsub.CancellationSignal;
import com.intteq.universal.pubsub.DeliveryAttempt;
import com.intteq.universal.pubsub.DeliveryOutcome;
import com.intteq.universal.pubsub.PubSubProperties;
import com.intteq.universal.pubsub.broker.DeliveryCallback;
import com.intteq.universal.pubsub.broker.MessageSettlement;
import com.intteq.universal.pubsub.broker.PubSubBroker;
import com.intteq.universal.pubsub.broker.SubscribeRequest;
import com.intteq.universal.pubsub.config.ResolvedSubscription;
import com.intteq.universal.pubsub.exception.PubSubConfigurationException;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;
import org.springframework.beans.factory.DisposableBean;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * RabbitMQ broker adapter with manual acknowledgement.
 *
 * <p>For every subscription it declares:
 * <ul>
 *     <li>a durable topic exchange named after the topic's provider name,</li>
 *     <li>a durable quorum queue named after the subscription's provider name, with
 *     {@code x-delivery-limit} set to the policy's {@code maxRetries},</li>
 *     <li>a dead-letter exchange {@code <queue>.dlx} and queue {@code <queue>.dlq},</li>
 * </ul>
 * and starts one listener container consuming the queue.
 *
 * <p>The delivery attempt is derived from the quorum queue's {@code x-delivery-count}
 * header. RabbitMQ has no per-message backoff: failed messages are requeued immediately
 * and the policy's backoff bounds are only reported in the logs.
 */
@Slf4j
@RequiredArgsConstructor
public class RabbitPubSubBroker implements PubSubBroker, DisposableBean {

    static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    private final ConnectionFactory connectionFactory;
    private final AmqpAdmin admin;
    private final PubSubProperties.RabbitMQ settings;

    /** Active listener containers keyed by queue name. */
    private final Map<String, SimpleMessageListenerContainer> containers = new ConcurrentHashMap<>();

    // =====================================================================
    // REGISTRATION
    // =====================================================================

    @Override
    public void subscribe(SubscribeRequest request, DeliveryCallback callback) {
        ResolvedSubscription descriptor = request.getDescriptor();
        String queueName = descriptor.getSubscriptionProviderName();

        if (containers.containsKey(queueName)) {
            throw new PubSubConfigurationException(
                    "RabbitMQ queue " + queueName + " is already consumed by another subscription");
        }

        declareTopology(descriptor.getTopicProviderName(), queueName, request);

        containers.computeIfAbsent(queueName, q -> createAndStartContainer(q, request, callback));
    }

    /**
     * Declares exchange, queue, dead-letter exchange/queue and bindings idempotently.
     */
    private void declareTopology(String exchangeName, String queueName, SubscribeRequest request) {
        String dlxName = queueName + ".dlx";
        String dlqName = queueName + ".dlq";

        TopicExchange exchange = new TopicExchange(exchangeName, true, false);
        TopicExchange dlx = new TopicExchange(dlxName, true, false);
        Queue dlq = QueueBuilder.durable(dlqName).build();

        Queue queue = QueueBuilder.durable(queueName)
                .quorum()
                .deliveryLimit(request.getRetryPolicy().getMaxRetries())
                .deadLetterExchange(dlxName)
                .build();

        admin.declareExchange(exchange);
        admin.declareExchange(dlx);
        admin.declareQueue(dlq);
        admin.declareBinding(BindingBuilder.bind(dlq).to(dlx).with("#"));
        admin.declareQueue(queue);
        admin.declareBinding(BindingBuilder.bind(queue).to(exchange).with("#"));

        log.info("RabbitMQ infra OK → exchange={} queue={} dlq={} deliveryLimit={} (backoff {}..{} not applied by RabbitMQ)",
                exchangeName, queueName, dlqName, request.getRetryPolicy().getMaxRetries(),
                request.getRetryPolicy().getMinBackoff(), request.getRetryPolicy().getMaxBackoff());
    }

    /**
     * Creates and starts a {@link SimpleMessageListenerContainer} configured for MANUAL acknowledgment.
     */
    private SimpleMessageListenerContainer createAndStartContainer(String queueName,
                                                                   SubscribeRequest request,
                                                                   DeliveryCallback callback) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);

        container.setQueueNames(queueName);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setPrefetchCount(settings.getPrefetch());
        container.setMissingQueuesFatal(false);
        container.setRecoveryInterval(settings.getRecoveryInterval());
        container.setMessageListener(
                (ChannelAwareMessageListener) (message, channel) -> handleDelivery(message, channel, request, callback));

        container.afterPropertiesSet();
        container.start();

        log.info("RabbitMQ listener started → queue={} prefetch={} topic={} subscription={}",
                queueName, settings.getPrefetch(), request.topic(), request.subscription());

        return container;
    }

    // =====================================================================
    // DELIVERY
    // =====================================================================

    void handleDelivery(Message message, Channel channel, SubscribeRequest request, DeliveryCallback callback) {
        MessageProperties props = message.getMessageProperties();
        DeliveryAttempt attempt = toAttempt(message);

        DeliveryOutcome outcome = callback.deliver(CancellationSignal.none(), attempt);

        MessageSettlement.forRabbitMQ(channel, props.getDeliveryTag())
                .settle(outcome, request, attempt.attempt());
    }

    static DeliveryAttempt toAttempt(Message message) {
        MessageProperties props = message.getMessageProperties();

        Map<String, String> attributes = new HashMap<>();
        props.getHeaders().forEach((name, value) -> {
            if (value != null) {
                attributes.put(name, value.toString());
            }
        });

        String messageId = props.getMessageId() != null
                ? props.getMessageId()
                : props.getConsumerTag() + ":" + props.getDeliveryTag();

        Instant publishTime = props.getTimestamp() != null
                ? props.getTimestamp().toInstant()
                : Instant.now();

        return DeliveryAttempt.builder()
                .messageId(messageId)
                .publishTime(publishTime)
                .attempt(attemptNumber(props))
                .attributes(attributes)
                .payload(message.getBody())
                .build();
    }

    /**
     * Quorum queues count previous failed deliveries in {@code x-delivery-count}.
     */
    static int attemptNumber(MessageProperties props) {
        Object count = props.getHeaders().get(DELIVERY_COUNT_HEADER);
        if (count instanceof Number n) {
            return n.intValue() + 1;
        }
        return Boolean.TRUE.equals(props.getRedelivered()) ? 2 : 1;
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    /**
     * Gracefully stops all RabbitMQ listener containers.
     */
    @Override
    public void destroy() {
        log.info("Stopping RabbitMQ listener containers...");

        containers.forEach((queue, container) -> {
            try {
                container.stop();
                log.info("Stopped RabbitMQ listener → queue={}", queue);
            } catch (Exception e) {
                log.warn("Failed to stop RabbitMQ listener → queue={}", queue, e);
            }
        });

        containers.clear();
    }
}
