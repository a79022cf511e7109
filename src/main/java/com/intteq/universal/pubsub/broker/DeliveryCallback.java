package com.intteq.universal.pubsub.broker;

import com.intteq.universal.pubsub.CancellationSignal;
import com.intteq.universal.pubsub.DeliveryAttempt;
import com.intteq.universal.pubsub.DeliveryOutcome;

/**
 * Callback a broker invokes once per delivery attempt.
 *
 * <p>Implementations never throw: every failure is reported through the returned
 * {@link DeliveryOutcome}. Brokers may invoke the callback concurrently.
 */
@FunctionalInterface
public interface DeliveryCallback {

    DeliveryOutcome deliver(CancellationSignal cancellation, DeliveryAttempt attempt);
}
