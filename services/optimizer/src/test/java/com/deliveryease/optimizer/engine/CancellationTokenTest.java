// =============================================================================
// DeliveryEase - Cancellation Token Tests
// =============================================================================
package com.deliveryease.optimizer.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.SplittableRandom;

import static com.deliveryease.optimizer.engine.RouteFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CancellationToken Tests")
class CancellationTokenTest {

    /**
     * Clock that only moves when told to.
     */
    private static final class SteppingClock extends Clock {

        private Instant now = Instant.parse("2024-05-01T08:00:00Z");

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    @DisplayName("Zero time limit is already reached")
    void testZeroDeadlineTripsImmediately() {
        CancellationToken token = CancellationToken.deadline(new SteppingClock(), Duration.ZERO);

        assertTrue(token.isCancellationRequested());
    }

    @Test
    @DisplayName("Future deadline trips once the clock reaches it")
    void testFutureDeadline() {
        SteppingClock clock = new SteppingClock();
        CancellationToken token = CancellationToken.deadline(clock, Duration.ofMillis(500));

        assertFalse(token.isCancellationRequested());

        clock.advance(Duration.ofMillis(499));
        assertFalse(token.isCancellationRequested());

        clock.advance(Duration.ofMillis(1));
        assertTrue(token.isCancellationRequested());
    }

    @Test
    @DisplayName("Flag trips only after cancel")
    void testFlag() {
        CancellationToken.Flag flag = CancellationToken.flag();

        assertFalse(flag.isCancellationRequested());
        flag.cancel();
        assertTrue(flag.isCancellationRequested());
    }

    @Test
    @DisplayName("None never trips")
    void testNone() {
        assertFalse(CancellationToken.none().isCancellationRequested());
    }

    @Test
    @DisplayName("Expired deadline stops a search at the first generation")
    void testDeadlineStopsSearch() {
        RouteEvaluator evaluator = new RouteEvaluator(EQUATOR_DEPOT, RouteCostModel.defaults());
        CancellationToken token = CancellationToken.deadline(new SteppingClock(), Duration.ZERO);

        SearchResult result = new GeneticSearch(evaluator, smallConfig(9), new SplittableRandom(9), token)
                .run(List.of(squareA(), squareB(), squareC()));

        assertTrue(result.isCancelled());
        assertEquals(0, result.getGenerationCount());
        assertEquals(3, result.getRoute().size());
    }
}
