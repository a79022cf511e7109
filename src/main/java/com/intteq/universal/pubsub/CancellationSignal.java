package com.intteq.universal.pubsub;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline information handed by the broker to a delivery.
 *
 * <p>The dispatch pipeline never enforces the deadline itself: handlers performing
 * long-running or asynchronous work are expected to consult this signal.
 */
public interface CancellationSignal {

    boolean isCancelled();

    Optional<Instant> deadline();

    /** A signal that is never cancelled and has no deadline. */
    static CancellationSignal none() {
        return NoCancellation.INSTANCE;
    }

    /** A signal that reports cancellation once the deadline has passed on the given clock. */
    static CancellationSignal withDeadline(Instant deadline, Clock clock) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        return new CancellationSignal() {
            @Override
            public boolean isCancelled() {
                return !clock.instant().isBefore(deadline);
            }

            @Override
            public Optional<Instant> deadline() {
                return Optional.of(deadline);
            }
        };
    }

    /** A signal cancelled explicitly by its owner. */
    static Source source() {
        return new Source();
    }

    /**
     * Cancellable signal controlled by the component that created it.
     */
    final class Source implements CancellationSignal {

        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Source() {
        }

        public void cancel() {
            cancelled.set(true);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }

        @Override
        public Optional<Instant> deadline() {
            return Optional.empty();
        }
    }

    enum NoCancellation implements CancellationSignal {
        INSTANCE;

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Optional<Instant> deadline() {
            return Optional.empty();
        }
    }
}
