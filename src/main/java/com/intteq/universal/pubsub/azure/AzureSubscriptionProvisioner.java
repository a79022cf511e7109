package com.intteq.universal.pubsub.azure;

import com.azure.core.exception.ResourceNotFoundException;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.models.CreateSubscriptionOptions;
import com.intteq.universal.pubsub.broker.SubscribeRequest;
import com.intteq.universal.pubsub.config.ResolvedSubscription;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Duration;

/**
 * Creates missing Service Bus topics and subscriptions before a processor starts.
 *
 * <p>New subscriptions get {@code maxDeliveryCount = maxRetries + 1} so that Service Bus
 * dead-letters a message once the retry budget is used up, even if the adapter is not
 * running. Existing entities are left untouched.
 *
 * <p>Administration calls are retried with jittered exponential backoff.
 */
@Slf4j
public class AzureSubscriptionProvisioner {

    private static final int MAX_ATTEMPTS = 6;
    private static final Duration BASE_DELAY = Duration.ofSeconds(1);
    private static final SecureRandom RNG = new SecureRandom();

    private final ServiceBusAdministrationClient admin;

    @Nullable
    private final MeterRegistry meterRegistry;

    private final Duration baseDelay;

    public AzureSubscriptionProvisioner(ServiceBusAdministrationClient admin, @Nullable MeterRegistry meterRegistry) {
        this(admin, meterRegistry, BASE_DELAY);
    }

    AzureSubscriptionProvisioner(ServiceBusAdministrationClient admin,
                                 @Nullable MeterRegistry meterRegistry,
                                 Duration baseDelay) {
        this.admin = admin;
        this.meterRegistry = meterRegistry;
        this.baseDelay = baseDelay;
    }

    public void ensureSubscription(SubscribeRequest request) {
        ResolvedSubscription descriptor = request.getDescriptor();
        String topic = descriptor.getTopicProviderName();
        String subscription = descriptor.getSubscriptionProviderName();

        retry("CreateTopic:" + topic, () -> {
            if (!topicExists(topic)) {
                admin.createTopic(topic);
                log.info("Created Service Bus topic: {}", topic);
            }
        });

        retry("CreateSubscription:" + topic + "/" + subscription, () -> {
            if (!subscriptionExists(topic, subscription)) {
                CreateSubscriptionOptions options = new CreateSubscriptionOptions()
                        .setMaxDeliveryCount(maxDeliveryCount(request));
                admin.createSubscription(topic, subscription, options);
                log.info("Created Service Bus subscription: {} → {} (maxDeliveryCount={})",
                        subscription, topic, options.getMaxDeliveryCount());
            }
        });
    }

    static int maxDeliveryCount(SubscribeRequest request) {
        int maxRetries = request.getRetryPolicy().getMaxRetries();
        return maxRetries == Integer.MAX_VALUE ? maxRetries : maxRetries + 1;
    }

    // ===========================================================
    // Retry with jitter exponential backoff
    // ===========================================================

    private void retry(String label, Runnable action) {
        Duration delay = baseDelay;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                action.run();
                if (meterRegistry != null) {
                    meterRegistry.counter("pubsub.azure.provision.success", "label", label).increment();
                }
                return;

            } catch (RuntimeException e) {
                if (attempt == MAX_ATTEMPTS) {
                    log.error("Final retry failed for {}: {}", label, e.getMessage());
                    throw e;
                }

                long jitter = delay.isZero() ? 0 : RNG.nextInt(300);
                long sleepMs = delay.toMillis() + jitter;

                log.warn("Retry {}/{} for {} failed: {} → retrying in {}ms",
                        attempt, MAX_ATTEMPTS, label, e.getMessage(), sleepMs);

                sleep(sleepMs);

                delay = delay.multipliedBy(2);
            }
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", e);
        }
    }

    // ===========================================================
    // Existence Checks
    // ===========================================================

    private boolean topicExists(String name) {
        try {
            admin.getTopic(name);
            return true;
        } catch (ResourceNotFoundException e) {
            return false;
        }
    }

    private boolean subscriptionExists(String topic, String sub) {
        try {
            admin.getSubscription(topic, sub);
            return true;
        } catch (ResourceNotFoundException e) {
            return false;
        }
    }
}
