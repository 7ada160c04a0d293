// =============================================================================
// DeliveryEase - Route Optimizer Service
// =============================================================================
package com.deliveryease.optimizer.service;

import com.deliveryease.optimizer.config.OptimizerProperties;
import com.deliveryease.optimizer.dto.RoutePlanRequest;
import com.deliveryease.optimizer.dto.RoutePlanResponse;
import com.deliveryease.optimizer.dto.RoutePlanResponse.*;
import com.deliveryease.optimizer.engine.AlgorithmConfig;
import com.deliveryease.optimizer.engine.CancellationToken;
import com.deliveryease.optimizer.engine.RouteEvaluator;
import com.deliveryease.optimizer.engine.RouteOptimizationException;
import com.deliveryease.optimizer.engine.RouteOptimizer;
import com.deliveryease.optimizer.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Service that plans delivery routes with the genetic route optimizer.
 * Applies configured defaults and per-request overrides, enforces the time
 * limit, and turns the optimizer's result into a route plan response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteOptimizerService {

    static final String ALGORITHM_DUAL_ROUTE = "Genetic algorithm with dual-route order crossover";
    static final String ALGORITHM_SINGLE_ROUTE = "Genetic algorithm";
    static final String ALGORITHM_NONE = "Direct evaluation";

    private final OptimizerProperties properties;
    private final RouteOptimizer routeOptimizer;
    private final Clock clock = Clock.systemUTC();

    /**
     * Plan a round trip from the depot before the driver departs.
     *
     * @param request Route plan request
     * @return Route plan
     */
    public RoutePlanResponse planFromDepot(RoutePlanRequest request) {
        return plan(request, OriginType.DEPOT);
    }

    /**
     * Re-plan from the driver's live position; the route still ends at the depot.
     *
     * @param request Route plan request with a current position
     * @return Route plan
     */
    public RoutePlanResponse planFromCurrentPosition(RoutePlanRequest request) {
        return plan(request, OriginType.CURRENT_POSITION);
    }

    private RoutePlanResponse plan(RoutePlanRequest request, OriginType originType) {
        long startTime = System.currentTimeMillis();
        String planId = UUID.randomUUID().toString().substring(0, 8).toUpperCase();

        List<Stop> stops = toStops(request.getStops());
        if (stops != null && stops.size() > properties.getMaxStops()) {
            throw new RouteOptimizationException(RouteOptimizationException.REASON_TOO_MANY_STOPS,
                    "at most " + properties.getMaxStops() + " stops per request, got " + stops.size());
        }

        Origin depot = request.getDepot() != null
                ? Origin.depot(request.getDepot().getLatitude(), request.getDepot().getLongitude(),
                        request.getDepot().getName(), request.getDepot().getAddress())
                : properties.toDepot();
        AlgorithmConfig config = applyOverrides(properties.toAlgorithmConfig(), request.getAlgorithm());
        CancellationToken deadline = properties.getTimeLimitMs() > 0
                ? CancellationToken.deadline(clock, Duration.ofMillis(properties.getTimeLimitMs()))
                : CancellationToken.none();

        log.info("Starting route optimization: planId={}, stops={}, origin={}, dualRoute={}",
                planId, stops == null ? 0 : stops.size(), originType, config.isDualRouteComparison());

        Origin start;
        OptimizedRoute route;
        if (originType == OriginType.CURRENT_POSITION) {
            start = request.getCurrentPosition() == null ? null
                    : Origin.currentPosition(request.getCurrentPosition().getLatitude(),
                            request.getCurrentPosition().getLongitude());
            route = routeOptimizer.optimizeFromCurrentPosition(stops, start, depot, config, deadline);
        } else {
            start = depot;
            route = routeOptimizer.optimizeFromDepot(stops, depot, config, deadline);
        }

        long solveTimeMs = System.currentTimeMillis() - startTime;

        if (route.getStatus() == RouteStatus.INTERRUPTED) {
            log.warn("Time limit reached, returning best route so far: planId={}, limitMs={}",
                    planId, properties.getTimeLimitMs());
        }
        log.info("Route optimization complete: planId={}, status={}, distance={}km, score={}, selected={}, timeMs={}",
                planId, route.getStatus(),
                String.format("%.2f", route.getTotalDistanceKm()),
                String.format("%.1f", route.getOptimizationScore()),
                route.getComparison() != null ? route.getComparison().getSelectedRoute() : "-",
                solveTimeMs);

        return toResponse(planId, route, new RouteEvaluator(start, depot, properties.toCostModel()), solveTimeMs);
    }

    static AlgorithmConfig applyOverrides(AlgorithmConfig defaults, RoutePlanRequest.AlgorithmOverrides overrides) {
        if (overrides == null) {
            return defaults;
        }
        AlgorithmConfig.AlgorithmConfigBuilder builder = defaults.toBuilder();
        if (overrides.getPopulationSize() != null) {
            builder.populationSize(overrides.getPopulationSize());
        }
        if (overrides.getMaxGenerations() != null) {
            builder.maxGenerations(overrides.getMaxGenerations());
        }
        if (overrides.getMutationRate() != null) {
            builder.mutationRate(overrides.getMutationRate());
        }
        if (overrides.getCrossoverRate() != null) {
            builder.crossoverRate(overrides.getCrossoverRate());
        }
        if (overrides.getEliteCount() != null) {
            builder.eliteCount(overrides.getEliteCount());
        }
        if (overrides.getConvergenceThreshold() != null) {
            builder.convergenceThreshold(overrides.getConvergenceThreshold());
        }
        if (overrides.getDualRouteComparison() != null) {
            builder.dualRouteComparison(overrides.getDualRouteComparison());
        }
        if (overrides.getRandomSeed() != null) {
            builder.randomSeed(overrides.getRandomSeed());
        }
        return builder.build();
    }

    private static List<Stop> toStops(List<RoutePlanRequest.StopRequest> requests) {
        if (requests == null) {
            return null;
        }
        List<Stop> stops = new ArrayList<>(requests.size());
        for (RoutePlanRequest.StopRequest request : requests) {
            stops.add(Stop.builder()
                    .id(request.getId())
                    .orderId(request.getOrderId())
                    .customerName(request.getCustomerName())
                    .address(request.getAddress())
                    .barangay(request.getBarangay())
                    .latitude(request.getLatitude())
                    .longitude(request.getLongitude())
                    .phone(request.getPhone())
                    .total(request.getTotal())
                    .deliveryStatus(request.getDeliveryStatus())
                    .priority(request.getPriority())
                    .timeWindow(request.getTimeWindow() == null ? null
                            : new TimeWindow(request.getTimeWindow().getStartHour(),
                                    request.getTimeWindow().getEndHour()))
                    .build());
        }
        return stops;
    }

    /**
     * Build the response, timing every geocoded stop from the route start.
     */
    private RoutePlanResponse toResponse(String planId,
                                         OptimizedRoute route,
                                         RouteEvaluator evaluator,
                                         long solveTimeMs) {
        double roadFactor = evaluator.getCostModel().getRoadFactor();
        double speed = evaluator.getCostModel().getAverageSpeedKmh();
        double handling = evaluator.getCostModel().getHandlingHoursPerStop();

        List<RouteStop> stops = new ArrayList<>();
        Stop previous = null;
        double currentTimeHours = 0;
        int sequence = 1;

        for (Stop stop : route.getStops()) {
            RouteStop.RouteStopBuilder routeStop = RouteStop.builder()
                    .sequence(sequence++)
                    .stopId(stop.getId())
                    .orderId(stop.getOrderId())
                    .customerName(stop.getCustomerName())
                    .address(stop.getAddress())
                    .barangay(stop.getBarangay())
                    .latitude(stop.getLatitude())
                    .longitude(stop.getLongitude())
                    .priority(stop.getPriority())
                    .geocoded(stop.hasCoordinates());

            if (stop.hasCoordinates()) {
                double legKm = (previous == null
                        ? evaluator.originDistance(stop)
                        : evaluator.distance(previous, stop)) * roadFactor;
                currentTimeHours += legKm / speed;
                double arrivalTime = currentTimeHours;
                currentTimeHours += handling;

                routeStop.distanceFromPreviousKm(round(legKm))
                        .arrivalTimeHours(round(arrivalTime))
                        .departureTimeHours(round(currentTimeHours));
                previous = stop;
            }
            stops.add(routeStop.build());
        }

        // Add depot return leg
        RouteStop returnLeg = null;
        if (previous != null) {
            Origin depot = evaluator.getDepot();
            double returnKm = evaluator.returnDistance(previous) * roadFactor;
            currentTimeHours += returnKm / speed;
            returnLeg = RouteStop.builder()
                    .sequence(sequence)
                    .customerName(depot.getName() != null ? depot.getName() : "Depot")
                    .address(depot.getAddress())
                    .latitude(depot.getLatitude())
                    .longitude(depot.getLongitude())
                    .geocoded(true)
                    .distanceFromPreviousKm(round(returnKm))
                    .arrivalTimeHours(round(currentTimeHours))
                    .departureTimeHours(round(currentTimeHours))
                    .build();
        }

        return RoutePlanResponse.builder()
                .planId(planId)
                .status(route.getStatus())
                .originType(route.getOriginType())
                .totalDistanceKm(round(route.getTotalDistanceKm()))
                .estimatedTimeHours(round(route.getEstimatedTimeHours()))
                .optimizationScore(round(route.getOptimizationScore()))
                .fuelCostEstimate(round(route.getFuelCostEstimate()))
                .fitnessScore(round(route.getFitnessScore()))
                .stops(stops)
                .returnLeg(returnLeg)
                .comparison(toComparison(route.getComparison()))
                .schedule(Schedule.builder()
                        .timeWindowPenalty(round(route.getSchedule().getTimeWindowPenalty()))
                        .priorityBonus(round(route.getSchedule().getPriorityBonus()))
                        .lateStopIds(route.getSchedule().getLateStopIds())
                        .build())
                .solverStats(SolverStats.builder()
                        .solveTimeMs(solveTimeMs)
                        .generations(route.getGenerationCount())
                        .algorithm(algorithmName(route))
                        .nearestStopMovedToFront(route.isNearestStopMovedToFront())
                        .build())
                .timestamp(Instant.now(clock))
                .build();
    }

    private static Comparison toComparison(RouteComparison comparison) {
        if (comparison == null) {
            return null;
        }
        return Comparison.builder()
                .routeA(toParent(comparison.getRouteA()))
                .routeB(toParent(comparison.getRouteB()))
                .selectedRoute(comparison.getSelectedRoute())
                .distanceImprovementKm(round(comparison.getDistanceImprovement()))
                .fitnessImprovement(round(comparison.getFitnessImprovement()))
                .crossoverIterations(comparison.getCrossover().getIterations())
                .crossoverFinalDistanceKm(round(comparison.getCrossover().getFinalDistanceKm()))
                .crossoverFinalFitness(round(comparison.getCrossover().getFinalFitness()))
                .improvedFromParents(comparison.getCrossover().isImprovedFromParents())
                .build();
    }

    private static ParentSummary toParent(RouteComparison.ParentRoute parent) {
        List<String> stopIds = new ArrayList<>(parent.getStops().size());
        for (Stop stop : parent.getStops()) {
            stopIds.add(stop.getId());
        }
        return ParentSummary.builder()
                .stopIds(stopIds)
                .totalDistanceKm(round(parent.getTotalDistanceKm()))
                .fitnessScore(round(parent.getFitnessScore()))
                .generationCount(parent.getGenerationCount())
                .build();
    }

    private static String algorithmName(OptimizedRoute route) {
        if (route.getStatus() == RouteStatus.TRIVIAL || route.getStatus() == RouteStatus.FALLBACK) {
            return ALGORITHM_NONE;
        }
        return route.getComparison() != null ? ALGORITHM_DUAL_ROUTE : ALGORITHM_SINGLE_ROUTE;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
