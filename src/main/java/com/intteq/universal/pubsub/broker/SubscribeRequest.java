package com.intteq.universal.pubsub.broker;

import com.intteq.universal.pubsub.RetryPolicy;
import com.intteq.universal.pubsub.config.ResolvedSubscription;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything a broker needs to start delivering messages for a subscription.
 */
@Value
public class SubscribeRequest {

    @NonNull
    ResolvedSubscription descriptor;

    /** Validated policy with every default applied. */
    @NonNull
    RetryPolicy retryPolicy;

    public String topic() {
        return descriptor.getTopic();
    }

    public String subscription() {
        return descriptor.getSubscription();
    }

    /**
     * Whether a failed attempt has used up the retry budget and must not be redelivered.
     */
    public boolean isRetryBudgetExhausted(int attempt) {
        return attempt > retryPolicy.getMaxRetries();
    }
}
