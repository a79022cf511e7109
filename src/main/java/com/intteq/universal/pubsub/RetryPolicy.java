package com.intteq.universal.pubsub;

import com.intteq.universal.pubsub.exception.PubSubConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Redelivery bounds for a subscription.
 *
 * <p>The policy is only validated and carried by this library; the broker decides
 * when and how a failed message is redelivered within these bounds.
 *
 * <p>Any field left {@code null} takes its default:
 * <ul>
 *     <li>{@code maxRetries} = {@value #DEFAULT_MAX_RETRIES}</li>
 *     <li>{@code minBackoff} = 10 seconds</li>
 *     <li>{@code maxBackoff} = 10 minutes</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 100;
    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofSeconds(10);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(10);

    Integer maxRetries;
    Duration minBackoff;
    Duration maxBackoff;

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_MIN_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    /**
     * Returns a copy of this policy with every omitted field set to its default.
     */
    public RetryPolicy withDefaults() {
        return new RetryPolicy(
                maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES,
                minBackoff != null ? minBackoff : DEFAULT_MIN_BACKOFF,
                maxBackoff != null ? maxBackoff : DEFAULT_MAX_BACKOFF);
    }

    /**
     * Resolves defaults and validates the result.
     *
     * @param policy the declared policy, may be {@code null}
     * @return a fully populated, validated policy
     * @throws PubSubConfigurationException if a bound is negative or the backoff range is inverted
     */
    public static RetryPolicy resolve(RetryPolicy policy) {
        RetryPolicy effective = policy != null ? policy.withDefaults() : defaults();
        effective.validate();
        return effective;
    }

    /**
     * Checks the bounds of a fully populated policy.
     *
     * @throws PubSubConfigurationException if a bound is negative or the backoff range is inverted
     */
    public void validate() {
        if (maxRetries == null || minBackoff == null || maxBackoff == null) {
            throw new PubSubConfigurationException("retry policy has unresolved defaults: " + this);
        }
        if (maxRetries < 0) {
            throw new PubSubConfigurationException("maxRetries cannot be negative: " + maxRetries);
        }
        if (minBackoff.isNegative()) {
            throw new PubSubConfigurationException("minBackoff cannot be negative: " + minBackoff);
        }
        if (maxBackoff.isNegative()) {
            throw new PubSubConfigurationException("maxBackoff cannot be negative: " + maxBackoff);
        }
        if (minBackoff.compareTo(maxBackoff) > 0) {
            throw new PubSubConfigurationException(
                    "minBackoff (" + minBackoff + ") cannot be greater than maxBackoff (" + maxBackoff + ")");
        }
    }
}
