// =============================================================================
// DeliveryEase - Route Evaluator Tests
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Origin;
import com.deliveryease.optimizer.model.Stop;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.deliveryease.optimizer.engine.RouteFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RouteEvaluator Tests")
class RouteEvaluatorTest {

    private final RouteEvaluator evaluator = new RouteEvaluator(EQUATOR_DEPOT, RouteCostModel.defaults());

    @Test
    @DisplayName("Route distance is the road factor times the sum of legs")
    void testRouteDistanceIsSumOfLegs() {
        Stop a = squareA();
        Stop b = squareB();
        Stop c = squareC();
        double legs = evaluator.originDistance(a)
                + evaluator.distance(a, b)
                + evaluator.distance(b, c)
                + evaluator.returnDistance(c);

        assertEquals(legs * 1.2, evaluator.routeDistance(List.of(a, b, c)), 1e-9);
    }

    @Test
    @DisplayName("Empty route has zero distance and zero time")
    void testEmptyRoute() {
        assertEquals(0.0, evaluator.routeDistance(List.of()));
        assertEquals(0.0, evaluator.estimatedTime(0, 0.0));
        assertEquals(0.0, evaluator.adjacencyBonus(List.of()));
        assertEquals(-1, evaluator.nearestToStartIndex(List.of()));
    }

    @Test
    @DisplayName("Single stop route is out and back with the road factor")
    void testSingleStopRoute() {
        Stop a = squareA();
        assertEquals(2 * evaluator.originDistance(a) * 1.2, evaluator.routeDistance(List.of(a)), 1e-9);
    }

    @Test
    @DisplayName("Live-position route opens at the start and closes at the depot")
    void testStartAndDepotDiffer() {
        Origin driver = Origin.currentPosition(0.0, 0.011);
        RouteEvaluator live = new RouteEvaluator(driver, EQUATOR_DEPOT, RouteCostModel.defaults());
        Stop c = squareC();

        double expected = (GeoDistance.haversineKm(0.0, 0.011, 0.0, 0.01)
                + GeoDistance.haversineKm(0.0, 0.01, 0.0, 0.0)) * 1.2;
        assertEquals(expected, live.routeDistance(List.of(c)), 1e-9);
    }

    @Test
    @DisplayName("Evaluating the same route twice gives identical values")
    void testEvaluationIsIdempotent() {
        List<Stop> route = List.of(squareB(), squareA(), squareC());

        RouteScore first = evaluator.score(route);
        RouteScore second = evaluator.score(route);

        assertEquals(first, second);
        assertEquals(evaluator.fuelCost(first.getDistanceKm()), evaluator.fuelCost(second.getDistanceKm()));
        assertEquals(evaluator.estimatedTime(3, first.getDistanceKm()), evaluator.estimatedTime(3, second.getDistanceKm()));
    }

    @Test
    @DisplayName("Fitness is 100 within baseline, drops 50 per baseline of excess, floors at 0")
    void testFitnessFormula() {
        // baseline for 4 stops is 6 km
        assertEquals(100.0, evaluator.fitness(5.0, 4), 1e-9);
        assertEquals(100.0, evaluator.fitness(6.0, 4), 1e-9);
        assertEquals(50.0, evaluator.fitness(12.0, 4), 1e-9);
        assertEquals(0.0, evaluator.fitness(40.0, 4), 1e-9);
        assertEquals(-30.0, evaluator.fitness(40.0, 4, -30.0), 1e-9);
        assertEquals(150.0, evaluator.fitness(3.0, 4, 50.0), 1e-9);
    }

    @Test
    @DisplayName("Opening with the nearest stop earns the adjacency reward")
    void testAdjacencyReward() {
        List<Stop> route = List.of(squareA(), squareB(), squareC());

        assertTrue(evaluator.opensWithNearestStop(route));
        assertEquals(50.0, evaluator.adjacencyBonus(route), 1e-9);
    }

    @Test
    @DisplayName("Opening away from the nearest stop is penalised ten per km, capped at 30")
    void testAdjacencyPenalty() {
        Stop a = squareA();
        Stop b = squareB();
        List<Stop> route = List.of(b, a, squareC());
        double gap = evaluator.originDistance(b) - evaluator.originDistance(a);

        assertFalse(evaluator.opensWithNearestStop(route));
        assertEquals(-Math.min(30.0, gap * 10.0), evaluator.adjacencyBonus(route), 1e-9);

        Stop far = stop("far", 0.1, 0.1);
        assertEquals(-30.0, evaluator.adjacencyBonus(List.of(far, a)), 1e-9);
    }

    @Test
    @DisplayName("Score combines route distance with fitness and adjacency bonus")
    void testScore() {
        List<Stop> route = List.of(squareA(), squareB(), squareC());
        RouteScore score = evaluator.score(route);
        double distance = evaluator.routeDistance(route);

        assertEquals(distance, score.getDistanceKm(), 1e-12);
        assertEquals(evaluator.fitness(distance, 3) + 50.0, score.getFitness(), 1e-9);
    }

    @Test
    @DisplayName("Nearest stop index picks the first of equally near stops")
    void testNearestToStartIndex() {
        // A and C are the same distance from the depot
        assertEquals(1, evaluator.nearestToStartIndex(List.of(squareB(), squareA(), squareC())));
        assertEquals(1, evaluator.nearestToStartIndex(List.of(squareB(), squareC(), squareA())));
    }

    @Test
    @DisplayName("Time, fuel and optimization score follow the cost model")
    void testTimeFuelAndScore() {
        assertEquals(10.0 / 30.0 + 3 * 0.33, evaluator.estimatedTime(3, 10.0), 1e-9);
        assertEquals(60.0, evaluator.fuelCost(10.0), 1e-9);
        assertEquals(100.0, evaluator.optimizationScore(6.0, 3), 1e-9);
        assertEquals(50.0, evaluator.optimizationScore(9.0, 3), 1e-9);
        assertEquals(0.0, evaluator.optimizationScore(30.0, 3), 1e-9);
        assertEquals(100.0, evaluator.optimizationScore(1.0, 3), 1e-9);
        assertEquals(100.0, evaluator.optimizationScore(0.0, 0), 1e-9);
    }
}
