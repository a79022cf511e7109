package com.intteq.universal.pubsub.azure;

import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.ServiceBusProcessorClient;
import com.azure.messaging.servicebus.ServiceBusReceivedMessage;
import com.azure.messaging.servicebus.ServiceBusReceivedMessageContext;
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
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Azure Service Bus broker adapter with manual settlement.
 *
 * <p>Each subscription gets its own {@link ServiceBusProcessorClient} with auto-complete
 * disabled. Successful deliveries are completed, failures abandoned for immediate
 * redelivery, and the last allowed attempt dead-lettered. Service Bus has no per-message
 * backoff, so the policy's backoff bounds are only reported in the logs.
 */
@Slf4j
public class AzureServiceBusPubSubBroker implements PubSubBroker, DisposableBean {

    private final ServiceBusClientBuilder clientBuilder;

    @Nullable
    private final AzureSubscriptionProvisioner provisioner;

    private final PubSubProperties.Azure settings;

    /** Active processors keyed by "topic/subscription" provider names. */
    private final Map<String, ServiceBusProcessorClient> processors = new ConcurrentHashMap<>();

    public AzureServiceBusPubSubBroker(ServiceBusClientBuilder clientBuilder,
                                       @Nullable AzureSubscriptionProvisioner provisioner,
                                       PubSubProperties.Azure settings) {
        this.clientBuilder = clientBuilder;
        this.provisioner = provisioner;
        this.settings = settings;
    }

    // =====================================================================
    // REGISTRATION
    // =====================================================================

    @Override
    public void subscribe(SubscribeRequest request, DeliveryCallback callback) {
        ResolvedSubscription descriptor = request.getDescriptor();
        String topic = descriptor.getTopicProviderName();
        String subscription = descriptor.getSubscriptionProviderName();
        String key = topic + "/" + subscription;

        if (processors.containsKey(key)) {
            throw new PubSubConfigurationException(
                    "Service Bus subscription " + key + " is already consumed by another subscription");
        }

        if (provisioner != null && settings.isProvisionSubscriptions()) {
            provisioner.ensureSubscription(request);
        }

        processors.computeIfAbsent(key, k -> createAndStartProcessor(topic, subscription, request, callback));
    }

    private ServiceBusProcessorClient createAndStartProcessor(String topic,
                                                              String subscription,
                                                              SubscribeRequest request,
                                                              DeliveryCallback callback) {
        ServiceBusProcessorClient processor = clientBuilder.processor()
                .topicName(topic)
                .subscriptionName(subscription)
                .disableAutoComplete()
                .maxConcurrentCalls(settings.getMaxConcurrentCalls())
                .processMessage(ctx -> handleMessage(ctx, request, callback))
                .processError(err -> log.error("Azure processor error (topic={} subscription={})",
                        topic, subscription, err.getException()))
                .buildProcessorClient();

        processor.start();

        log.info("Azure listener started → topic={} subscription={} concurrency={} (backoff {}..{} not applied by Service Bus)",
                topic, subscription, settings.getMaxConcurrentCalls(),
                request.getRetryPolicy().getMinBackoff(), request.getRetryPolicy().getMaxBackoff());

        return processor;
    }

    // =====================================================================
    // DELIVERY
    // =====================================================================

    void handleMessage(ServiceBusReceivedMessageContext ctx, SubscribeRequest request, DeliveryCallback callback) {
        DeliveryAttempt attempt = toAttempt(ctx.getMessage());

        DeliveryOutcome outcome = callback.deliver(CancellationSignal.none(), attempt);

        MessageSettlement.forAzureProcessor(ctx).settle(outcome, request, attempt.attempt());
    }

    static DeliveryAttempt toAttempt(ServiceBusReceivedMessage message) {
        Map<String, String> attributes = new HashMap<>();
        message.getApplicationProperties().forEach((name, value) -> {
            if (value != null) {
                attributes.put(name, value.toString());
            }
        });

        Instant publishTime = message.getEnqueuedTime() != null
                ? message.getEnqueuedTime().toInstant()
                : Instant.now();

        return DeliveryAttempt.builder()
                .messageId(message.getMessageId() != null ? message.getMessageId() : Long.toString(message.getSequenceNumber()))
                .publishTime(publishTime)
                // Service Bus counts the current delivery
                .attempt((int) Math.max(1L, message.getDeliveryCount()))
                .attributes(attributes)
                .payload(message.getBody().toBytes())
                .build();
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    /**
     * Gracefully stops all Azure processors.
     */
    @Override
    public void destroy() {
        log.info("Stopping Azure Service Bus processors...");

        processors.forEach((key, processor) -> {
            try {
                processor.stop();
                processor.close();
                log.info("Stopped Azure processor → {}", key);
            } catch (Exception e) {
                log.warn("Failed to stop Azure processor → {}", key, e);
            }
        });

        processors.clear();
    }
}
