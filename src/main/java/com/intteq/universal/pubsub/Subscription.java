package com.intteq.universal.pubsub;

import com.intteq.universal.pubsub.config.ResolvedSubscription;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Handle for a registered subscription.
 *
 * <p>Subscription names are unique within their topic. Once deployed, never rename
 * a subscription: messages in flight under the old name would be lost.
 *
 * @param <T> the topic's message type
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class Subscription<T> {

    private final Topic<T> topic;
    private final String name;
    private final RetryPolicy retryPolicy;
    private final ResolvedSubscription descriptor;

    @Override
    public String toString() {
        return "Subscription[" + topic.name() + "/" + name + "]";
    }
}
