// =============================================================================
// DeliveryEase - Dual Route Comparator Tests
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.RouteComparison;
import com.deliveryease.optimizer.model.SelectedRoute;
import com.deliveryease.optimizer.model.Stop;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.deliveryease.optimizer.engine.RouteFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DualRouteComparator Tests")
class DualRouteComparatorTest {

    private final RouteEvaluator square = new RouteEvaluator(EQUATOR_DEPOT, RouteCostModel.defaults());
    private final RouteEvaluator city = new RouteEvaluator(CDO_DEPOT, RouteCostModel.defaults());

    private DualRouteComparator comparator(RouteEvaluator evaluator, long seed) {
        return new DualRouteComparator(evaluator, smallConfig(seed), new SplittableRandom(seed),
                CancellationToken.none(), null);
    }

    private SearchResult result(RouteEvaluator evaluator, List<Stop> route, int generations) {
        return new SearchResult(route, generations, evaluator.routeDistance(route), TerminationReason.CONVERGED);
    }

    private static List<Stop> cityStops() {
        return List.of(
                stop("s1", 8.5000, 124.6600),
                stop("s2", 8.4900, 124.6520),
                stop("s3", 8.4700, 124.6800),
                stop("s4", 8.5100, 124.6300),
                stop("s5", 8.4600, 124.6400),
                stop("s6", 8.4950, 124.6900)
        );
    }

    @Test
    @DisplayName("Parent A config shrinks population and mutation")
    void testParentAConfig() {
        AlgorithmConfig a = DualRouteComparator.parentAConfig(AlgorithmConfig.defaults());

        assertEquals(80, a.getPopulationSize());
        assertEquals(0.016, a.getMutationRate(), 1e-12);
        assertEquals(1.0, a.getCrossoverRate(), 1e-12);
        assertEquals("route_a", a.getSeedLabel());
    }

    @Test
    @DisplayName("Parent B config grows population and mutation, trims crossover")
    void testParentBConfig() {
        AlgorithmConfig b = DualRouteComparator.parentBConfig(AlgorithmConfig.defaults());

        assertEquals(120, b.getPopulationSize());
        assertEquals(0.024, b.getMutationRate(), 1e-12);
        assertEquals(0.9, b.getCrossoverRate(), 1e-12);
        assertEquals("route_b", b.getSeedLabel());
    }

    @Test
    @DisplayName("Derived parent configs stay valid at the edges")
    void testDerivedConfigsClamp() {
        AlgorithmConfig base = AlgorithmConfig.builder()
                .populationSize(2)
                .eliteCount(2)
                .mutationRate(0.9)
                .build();

        AlgorithmConfig a = DualRouteComparator.parentAConfig(base).validate();
        AlgorithmConfig b = DualRouteComparator.parentBConfig(base).validate();

        assertEquals(2, a.getPopulationSize());
        assertEquals(2, a.getEliteCount());
        assertEquals(1.0, b.getMutationRate(), 1e-12);
    }

    @Test
    @DisplayName("Shorter parent A is selected with a non-negative improvement")
    void testSelectsShorterParentA() {
        List<Stop> optimal = List.of(squareA(), squareB(), squareC());
        List<Stop> detour = List.of(squareB(), squareA(), squareC());

        DualRouteOutcome outcome = comparator(square, 1)
                .compare(result(square, optimal, 60), result(square, detour, 75));
        RouteComparison comparison = outcome.getComparison();

        assertEquals(SelectedRoute.A, comparison.getSelectedRoute());
        assertTrue(comparison.getDistanceImprovement() >= 0.0);
        assertEquals(optimal, outcome.getRoute());
        assertEquals(square.routeDistance(optimal), outcome.getDistanceKm(), 1e-12);
        assertEquals(75, outcome.getGenerationCount());
        assertFalse(comparison.getCrossover().isImprovedFromParents());
        assertEquals(10, comparison.getCrossover().getIterations());
    }

    @Test
    @DisplayName("Shorter parent B wins when refinement cannot beat it")
    void testSelectsShorterParentB() {
        List<Stop> detour = List.of(squareB(), squareA(), squareC());
        List<Stop> optimal = List.of(squareA(), squareB(), squareC());

        DualRouteOutcome outcome = comparator(square, 2)
                .compare(result(square, detour, 40), result(square, optimal, 40));

        assertEquals(SelectedRoute.B, outcome.getComparison().getSelectedRoute());
        assertEquals(optimal, outcome.getRoute());
        assertEquals(0.0, outcome.getComparison().getDistanceImprovement(), 1e-12);
        assertEquals(0.0, outcome.getComparison().getFitnessImprovement(), 1e-12);
    }

    @Test
    @DisplayName("Equal parents resolve to route B")
    void testTieGoesToRouteB() {
        List<Stop> routeA = List.of(squareA(), squareB(), squareC());
        List<Stop> routeB = List.of(squareA(), squareB(), squareC());

        DualRouteOutcome outcome = comparator(square, 3)
                .compare(result(square, routeA, 10), result(square, routeB, 10));

        assertEquals(SelectedRoute.B, outcome.getComparison().getSelectedRoute());
        assertSame(routeB, outcome.getRoute());
        assertEquals(0.0, outcome.getComparison().getDistanceImprovement(), 1e-12);
    }

    @Test
    @DisplayName("Comparison records both parents")
    void testComparisonRecordsParents() {
        List<Stop> a = List.of(squareA(), squareB(), squareC());
        List<Stop> b = List.of(squareB(), squareA(), squareC());

        RouteComparison comparison = comparator(square, 4)
                .compare(result(square, a, 12), result(square, b, 34))
                .getComparison();

        assertEquals(a, comparison.getRouteA().getStops());
        assertEquals(b, comparison.getRouteB().getStops());
        assertEquals(12, comparison.getRouteA().getGenerationCount());
        assertEquals(34, comparison.getRouteB().getGenerationCount());
        assertEquals(square.score(a).getFitness(), comparison.getRouteA().getFitnessScore(), 1e-12);
        assertTrue(comparison.getRouteA().getTotalDistanceKm() < comparison.getRouteB().getTotalDistanceKm());
    }

    @Test
    @DisplayName("Full run returns a permutation no longer than either parent")
    void testRunSequential() {
        DualRouteOutcome outcome = comparator(city, 5).run(cityStops());
        RouteComparison comparison = outcome.getComparison();

        assertEquals(new HashSet<>(cityStops()), new HashSet<>(outcome.getRoute()));
        assertTrue(outcome.getDistanceKm() <= comparison.getRouteA().getTotalDistanceKm() + 1e-9);
        assertTrue(outcome.getDistanceKm() <= comparison.getRouteB().getTotalDistanceKm() + 1e-9);
        assertFalse(outcome.isInterrupted());
    }

    @Test
    @DisplayName("Parallel and sequential parents agree for the same seed")
    void testParallelMatchesSequential() {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            DualRouteOutcome sequential = comparator(city, 6).run(cityStops());
            DualRouteOutcome parallel = new DualRouteComparator(city, smallConfig(6), new SplittableRandom(6),
                    CancellationToken.none(), executor).run(cityStops());

            assertEquals(sequential.getRoute(), parallel.getRoute());
            assertEquals(sequential.getDistanceKm(), parallel.getDistanceKm(), 1e-12);
            assertEquals(sequential.getComparison().getSelectedRoute(), parallel.getComparison().getSelectedRoute());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A failing parent stops its sibling and the failure propagates")
    void testParentFailureStopsSibling() throws InterruptedException {
        AtomicBoolean failed = new AtomicBoolean();
        AtomicInteger polls = new AtomicInteger();
        CancellationToken failOnce = () -> {
            if (failed.compareAndSet(false, true)) {
                throw new IllegalStateException("search aborted");
            }
            polls.incrementAndGet();
            return false;
        };
        AlgorithmConfig endless = smallConfig(8).toBuilder()
                .maxGenerations(1_000_000)
                .stagnationLimit(1_000_000)
                .build();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            DualRouteComparator comparator = new DualRouteComparator(city, endless, new SplittableRandom(8),
                    failOnce, executor);

            IllegalStateException ex = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> assertThrows(IllegalStateException.class, () -> comparator.run(cityStops())));
            assertEquals("search aborted", ex.getMessage());

            int pollsAfterFailure = polls.get();
            Thread.sleep(100);
            assertEquals(pollsAfterFailure, polls.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Cancelled parents mark the outcome interrupted")
    void testCancelledRunIsInterrupted() {
        CancellationToken.Flag flag = CancellationToken.flag();
        flag.cancel();

        DualRouteOutcome outcome = new DualRouteComparator(city, smallConfig(7), new SplittableRandom(7),
                flag, null).run(cityStops());

        assertTrue(outcome.isInterrupted());
        assertEquals(0, outcome.getGenerationCount());
        assertEquals(cityStops().size(), outcome.getRoute().size());
    }
}
