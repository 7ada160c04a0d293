// =============================================================================
// DeliveryEase - Cooperative Cancellation
// =============================================================================
package com.deliveryease.optimizer.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polled once per generation; a search that sees a request stops at the
 * generation boundary and returns the best route it has.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    static CancellationToken none() {
        return NONE;
    }

    /**
     * Token that trips once {@code limit} has elapsed on {@code clock}.
     */
    static CancellationToken deadline(Clock clock, Duration limit) {
        Instant deadline = clock.instant().plus(limit);
        return () -> !clock.instant().isBefore(deadline);
    }

    /**
     * Token tripped by {@link Flag#cancel()}, for callers that abort on demand.
     */
    static Flag flag() {
        return new Flag();
    }

    final class Flag implements CancellationToken {

        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Flag() {
        }

        public void cancel() {
            cancelled.set(true);
        }

        @Override
        public boolean isCancellationRequested() {
            return cancelled.get();
        }
    }
}
