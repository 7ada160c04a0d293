// =============================================================================
// DeliveryEase - Genetic Route Optimizer
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.OptimizedRoute;
import com.deliveryease.optimizer.model.Origin;
import com.deliveryease.optimizer.model.OriginType;
import com.deliveryease.optimizer.model.RouteComparison;
import com.deliveryease.optimizer.model.RouteStatus;
import com.deliveryease.optimizer.model.Stop;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.Executor;

/**
 * Entry point of the optimization engine.
 * <p>
 * Plans a single driver's route either from the depot before departure or
 * from the driver's live position mid-route. Stops without coordinates ride
 * along at the tail of the route. Inputs with fewer than three usable stops
 * skip the search. Calls share no state; the optimizer itself is thread-safe.
 */
@Slf4j
public class RouteOptimizer {

    private static final int TRIVIAL_STOP_LIMIT = 2;
    private static final double TRIVIAL_OPTIMIZATION_SCORE = 100.0;

    private final RouteCostModel costModel;
    private final Executor parentExecutor;
    private final ScheduleAnalyzer scheduleAnalyzer;

    public RouteOptimizer(RouteCostModel costModel) {
        this(costModel, null);
    }

    /**
     * @param parentExecutor runs the two dual-route searches concurrently;
     *                       null runs them sequentially
     */
    public RouteOptimizer(RouteCostModel costModel, Executor parentExecutor) {
        this.costModel = costModel;
        this.parentExecutor = parentExecutor;
        this.scheduleAnalyzer = new ScheduleAnalyzer(costModel);
    }

    public OptimizedRoute optimizeFromDepot(List<Stop> stops, Origin depot, AlgorithmConfig config) {
        return optimizeFromDepot(stops, depot, config, CancellationToken.none());
    }

    /**
     * Plans a round trip that starts and ends at the depot.
     */
    public OptimizedRoute optimizeFromDepot(List<Stop> stops,
                                            Origin depot,
                                            AlgorithmConfig config,
                                            CancellationToken cancellation) {
        requireOrigin(depot, "depot");
        return optimize(stops, depot, depot, config, cancellation, OriginType.DEPOT);
    }

    public OptimizedRoute optimizeFromCurrentPosition(List<Stop> stops,
                                                      Origin currentPosition,
                                                      Origin depot,
                                                      AlgorithmConfig config) {
        return optimizeFromCurrentPosition(stops, currentPosition, depot, config, CancellationToken.none());
    }

    /**
     * Re-plans from the driver's live position. The opening leg starts at
     * {@code currentPosition}, the closing leg still returns to the depot, and
     * the stop nearest the driver is moved to the front before seeding.
     */
    public OptimizedRoute optimizeFromCurrentPosition(List<Stop> stops,
                                                      Origin currentPosition,
                                                      Origin depot,
                                                      AlgorithmConfig config,
                                                      CancellationToken cancellation) {
        requireOrigin(currentPosition, "currentPosition");
        requireOrigin(depot, "depot");
        return optimize(stops, currentPosition, depot, config, cancellation, OriginType.CURRENT_POSITION);
    }

    private OptimizedRoute optimize(List<Stop> stops,
                                    Origin start,
                                    Origin depot,
                                    AlgorithmConfig config,
                                    CancellationToken cancellation,
                                    OriginType originType) {
        requireStops(stops);
        if (config == null) {
            throw new RouteOptimizationException(RouteOptimizationException.REASON_INVALID_CONFIG,
                    "algorithm config is required");
        }
        config.validate();
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();

        RouteEvaluator evaluator = new RouteEvaluator(start, depot, costModel);
        List<Stop> valid = new ArrayList<>();
        List<Stop> invalid = new ArrayList<>();
        for (Stop stop : stops) {
            (stop.hasCoordinates() ? valid : invalid).add(stop);
        }

        if (stops.isEmpty()) {
            return trivialRoute(List.of(), List.of(), evaluator, originType);
        }
        if (valid.size() < TRIVIAL_STOP_LIMIT && !invalid.isEmpty()) {
            log.warn("Not enough geocoded stops to optimize: valid={}, missingCoordinates={}",
                    valid.size(), invalid.size());
            return fallbackRoute(stops, evaluator, originType);
        }
        if (valid.size() <= TRIVIAL_STOP_LIMIT) {
            return trivialRoute(leadWithNearest(valid, evaluator), invalid, evaluator, originType);
        }

        List<Stop> candidates = valid;
        if (originType == OriginType.CURRENT_POSITION) {
            candidates = leadWithNearest(valid, evaluator);
            log.debug("Live re-plan: nearest stop {} moved to the front", candidates.get(0).getId());
        }

        SplittableRandom random = config.getRandomSeed() != null
                ? new SplittableRandom(config.getRandomSeed())
                : new SplittableRandom();

        log.debug("Phase {}: validStops={}, missingCoordinates={}, origin={}",
                OptimizationPhase.SEEDING, candidates.size(), invalid.size(), originType);

        List<Stop> route;
        int generations;
        boolean interrupted;
        RouteComparison comparison = null;
        if (config.isDualRouteComparison()) {
            log.debug("Phase {}", OptimizationPhase.DUAL_COMPARING);
            DualRouteOutcome outcome = new DualRouteComparator(
                    evaluator, config, random, token, parentExecutor).run(candidates);
            route = outcome.getRoute();
            generations = outcome.getGenerationCount();
            interrupted = outcome.isInterrupted();
            comparison = outcome.getComparison();
        } else {
            log.debug("Phase {}", OptimizationPhase.EVOLVING);
            SearchResult result = new GeneticSearch(evaluator, config, random, token).run(candidates);
            route = result.getRoute();
            generations = result.getGenerationCount();
            interrupted = result.isCancelled();
        }

        log.debug("Phase {}: generations={}, interrupted={}", OptimizationPhase.EVALUATING, generations, interrupted);
        boolean movedNearest = !evaluator.opensWithNearestStop(route);
        if (movedNearest) {
            log.info("Winning route opens with {} instead of the nearest stop, moving nearest to the front",
                    route.get(0).getId());
            route = leadWithNearest(route, evaluator);
        }

        OptimizedRoute optimized = finish(route, invalid, evaluator, originType)
                .generationCount(generations)
                .status(interrupted ? RouteStatus.INTERRUPTED : RouteStatus.OPTIMIZED)
                .comparison(comparison)
                .nearestStopMovedToFront(movedNearest)
                .build();
        log.debug("Phase {}: distance={}km, score={}", OptimizationPhase.DONE,
                String.format("%.2f", optimized.getTotalDistanceKm()),
                String.format("%.1f", optimized.getOptimizationScore()));
        return optimized;
    }

    /**
     * Direct evaluation without search; the score is fixed at 100.
     */
    private OptimizedRoute trivialRoute(List<Stop> valid,
                                        List<Stop> invalid,
                                        RouteEvaluator evaluator,
                                        OriginType originType) {
        return finish(valid, invalid, evaluator, originType)
                .optimizationScore(TRIVIAL_OPTIMIZATION_SCORE)
                .generationCount(0)
                .status(RouteStatus.TRIVIAL)
                .build();
    }

    /**
     * Stops in input order with flat per-stop estimates, used when geocoding
     * is too sparse to plan with.
     */
    private OptimizedRoute fallbackRoute(List<Stop> stops, RouteEvaluator evaluator, OriginType originType) {
        double distance = stops.size() * costModel.getFallbackKmPerStop();
        return OptimizedRoute.builder()
                .stops(List.copyOf(stops))
                .totalDistanceKm(distance)
                .estimatedTimeHours(stops.size() * costModel.getFallbackHoursPerStop())
                .optimizationScore(costModel.getFallbackOptimizationScore())
                .fuelCostEstimate(evaluator.fuelCost(distance))
                .generationCount(0)
                .fitnessScore(evaluator.fitness(distance, stops.size()))
                .status(RouteStatus.FALLBACK)
                .originType(originType)
                .schedule(scheduleAnalyzer.assess(stops))
                .build();
    }

    /**
     * Metrics over the geocoded route with the remaining stops appended.
     */
    private OptimizedRoute.OptimizedRouteBuilder finish(List<Stop> route,
                                                        List<Stop> invalid,
                                                        RouteEvaluator evaluator,
                                                        OriginType originType) {
        double distance = evaluator.routeDistance(route);
        List<Stop> stops = new ArrayList<>(route.size() + invalid.size());
        stops.addAll(route);
        stops.addAll(invalid);

        return OptimizedRoute.builder()
                .stops(List.copyOf(stops))
                .totalDistanceKm(distance)
                .estimatedTimeHours(evaluator.estimatedTime(stops.size(), distance))
                .optimizationScore(evaluator.optimizationScore(distance, stops.size()))
                .fuelCostEstimate(evaluator.fuelCost(distance))
                .fitnessScore(evaluator.fitness(distance, route.size(), evaluator.adjacencyBonus(route)))
                .originType(originType)
                .schedule(scheduleAnalyzer.assess(stops));
    }

    /**
     * Copy of {@code stops} with the stop nearest the start moved to index 0;
     * the others keep their relative order.
     */
    private static List<Stop> leadWithNearest(List<Stop> stops, RouteEvaluator evaluator) {
        List<Stop> ordered = new ArrayList<>(stops);
        int nearest = evaluator.nearestToStartIndex(ordered);
        if (nearest > 0) {
            ordered.add(0, ordered.remove(nearest));
        }
        return ordered;
    }

    private static void requireStops(List<Stop> stops) {
        if (stops == null) {
            throw new RouteOptimizationException(RouteOptimizationException.REASON_STOPS_REQUIRED,
                    "stop list is required");
        }
        Set<String> ids = new HashSet<>();
        for (Stop stop : stops) {
            if (stop == null) {
                throw new RouteOptimizationException(RouteOptimizationException.REASON_STOP_REQUIRED,
                        "stop list must not contain null entries");
            }
            if (stop.getId() == null || stop.getId().isBlank()) {
                throw new RouteOptimizationException(RouteOptimizationException.REASON_STOP_ID_REQUIRED,
                        "every stop needs a non-blank id");
            }
            if (!ids.add(stop.getId())) {
                throw new RouteOptimizationException(RouteOptimizationException.REASON_DUPLICATE_STOP_ID,
                        "duplicate stop id: " + stop.getId());
            }
        }
    }

    private static void requireOrigin(Origin origin, String name) {
        if (origin == null) {
            throw new RouteOptimizationException(RouteOptimizationException.REASON_ORIGIN_REQUIRED,
                    name + " is required");
        }
    }
}
