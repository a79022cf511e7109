package com.intteq.universal.pubsub.broker;

import com.azure.messaging.servicebus.ServiceBusReceivedMessageContext;
import com.azure.messaging.servicebus.models.DeadLetterOptions;
import com.intteq.universal.pubsub.DeliveryOutcome;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Provider-neutral settlement of a delivered message for RabbitMQ and Azure Service Bus.
 *
 * <p>Usage:
 * <pre>
 *   // RabbitMQ
 *   MessageSettlement s = MessageSettlement.forRabbitMQ(channel, deliveryTag);
 *
 *   // Azure (processor)
 *   MessageSettlement s = MessageSettlement.forAzureProcessor(processContext);
 *
 *   s.settle(outcome, request, attempt);
 * </pre>
 *
 * <p>All SDK failures are wrapped in {@link SettlementException}.
 */
@Slf4j
public final class MessageSettlement {

    public static final String RETRIES_EXHAUSTED = "max-retries-exceeded";

    private final Channel rabbitChannel;
    private final long rabbitDeliveryTag;

    private final ServiceBusReceivedMessageContext azureContext;

    // -----------------------
    // Factory methods
    // -----------------------

    public static MessageSettlement forRabbitMQ(Channel channel, long deliveryTag) {
        Objects.requireNonNull(channel, "channel must not be null");
        return new MessageSettlement(channel, deliveryTag, null);
    }

    public static MessageSettlement forAzureProcessor(ServiceBusReceivedMessageContext context) {
        Objects.requireNonNull(context, "ServiceBusReceivedMessageContext must not be null");
        return new MessageSettlement(null, 0L, context);
    }

    private MessageSettlement(Channel rabbitChannel,
                              long rabbitDeliveryTag,
                              ServiceBusReceivedMessageContext azureContext) {
        this.rabbitChannel = rabbitChannel;
        this.rabbitDeliveryTag = rabbitDeliveryTag;
        this.azureContext = azureContext;
    }

    public boolean isRabbit() {
        return rabbitChannel != null;
    }

    // -----------------------
    // Outcome mapping
    // -----------------------

    /**
     * Settles the message according to the dispatcher's outcome: acknowledge on success,
     * dead-letter once the retry budget is used up, otherwise hand it back for redelivery.
     */
    public void settle(DeliveryOutcome outcome, SubscribeRequest request, int attempt) {
        if (outcome.isAcknowledged()) {
            ack();
            return;
        }

        if (request.isRetryBudgetExhausted(attempt)) {
            log.warn("Retry budget exhausted → dead-lettering (topic={} subscription={} attempt={} maxRetries={})",
                    request.topic(), request.subscription(), attempt, request.getRetryPolicy().getMaxRetries());
            deadLetter(RETRIES_EXHAUSTED, describe(outcome));
        } else {
            nack();
        }
    }

    // -----------------------
    // Settlement operations
    // -----------------------

    /**
     * RabbitMQ: basicAck. Azure: complete.
     */
    public void ack() {
        try {
            if (isRabbit()) {
                rabbitChannel.basicAck(rabbitDeliveryTag, false);
                log.debug("RabbitMQ ack successful (tag={})", rabbitDeliveryTag);
            } else {
                azureContext.complete();
                log.debug("Azure complete successful (messageId={})", azureMessageId());
            }
        } catch (Exception e) {
            throw new SettlementException("Failed to ack message", e);
        }
    }

    /**
     * RabbitMQ: basicNack with requeue. Azure: abandon.
     */
    public void nack() {
        try {
            if (isRabbit()) {
                rabbitChannel.basicNack(rabbitDeliveryTag, false, true);
                log.debug("RabbitMQ nack (requeued) issued (tag={})", rabbitDeliveryTag);
            } else {
                azureContext.abandon();
                log.debug("Azure abandon issued (messageId={})", azureMessageId());
            }
        } catch (Exception e) {
            throw new SettlementException("Failed to nack/abandon message", e);
        }
    }

    /**
     * RabbitMQ: basicNack without requeue, routing to the queue's dead-letter exchange.
     * Azure: dead-letter with reason and description.
     */
    public void deadLetter(String reason, String description) {
        try {
            if (isRabbit()) {
                rabbitChannel.basicNack(rabbitDeliveryTag, false, false);
                log.debug("RabbitMQ dead-letter via basicNack (tag={}) reason={}", rabbitDeliveryTag, reason);
            } else {
                DeadLetterOptions options = new DeadLetterOptions()
                        .setDeadLetterReason(reason)
                        .setDeadLetterErrorDescription(description);
                azureContext.deadLetter(options);
                log.debug("Azure dead-lettered message (messageId={}) reason={}", azureMessageId(), reason);
            }
        } catch (Exception e) {
            throw new SettlementException("Failed to dead-letter message", e);
        }
    }

    // -----------------------
    // Utilities
    // -----------------------

    private static String describe(DeliveryOutcome outcome) {
        return outcome.error()
                .map(e -> e.getMessage() != null ? e.getMessage() : e.getClass().getName())
                .orElse("delivery failed");
    }

    private String azureMessageId() {
        return azureContext.getMessage() != null ? azureContext.getMessage().getMessageId() : "<n/a>";
    }

    /**
     * Runtime exception used to wrap provider SDK failures during settlement.
     */
    public static class SettlementException extends RuntimeException {
        public SettlementException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
