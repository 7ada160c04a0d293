// =============================================================================
// DeliveryEase - Route Evaluator
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Origin;
import com.deliveryease.optimizer.model.Stop;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Distance, fitness and cost formulas for routes that start at a fixed
 * origin and close at the depot. Holds no mutable state.
 */
public class RouteEvaluator {

    @Getter
    private final Origin start;

    @Getter
    private final Origin depot;

    @Getter
    private final RouteCostModel costModel;

    private final GeoDistance geo;

    /**
     * Evaluator for a round trip from the depot.
     */
    public RouteEvaluator(Origin depot, RouteCostModel costModel) {
        this(depot, depot, costModel);
    }

    /**
     * Evaluator for a route opening at {@code start} and closing at {@code depot}.
     */
    public RouteEvaluator(Origin start, Origin depot, RouteCostModel costModel) {
        this.start = Objects.requireNonNull(start, "start");
        this.depot = Objects.requireNonNull(depot, "depot");
        this.costModel = Objects.requireNonNull(costModel, "costModel");
        this.geo = new GeoDistance(costModel.getMissingCoordinatePenaltyKm());
    }

    public double distance(Stop from, Stop to) {
        return geo.between(from, to);
    }

    /**
     * Straight-line distance from the route's start to the stop.
     */
    public double originDistance(Stop stop) {
        return geo.toOrigin(stop, start);
    }

    /**
     * Straight-line distance from the stop back to the depot.
     */
    public double returnDistance(Stop stop) {
        return geo.toOrigin(stop, depot);
    }

    /**
     * Road distance of start, every stop in order, then the depot.
     */
    public double routeDistance(List<Stop> route) {
        if (route.isEmpty()) {
            return 0.0;
        }
        double total = originDistance(route.get(0));
        for (int i = 0; i < route.size() - 1; i++) {
            total += distance(route.get(i), route.get(i + 1));
        }
        total += returnDistance(route.get(route.size() - 1));
        return total * costModel.getRoadFactor();
    }

    public double fitness(double distanceKm, int stopCount) {
        return fitness(distanceKm, stopCount, 0.0);
    }

    /**
     * Distance-based fitness: 100 at or below the per-stop baseline, dropping
     * by 50 per baseline of excess, floored at 0, then shifted by {@code bonus}.
     */
    public double fitness(double distanceKm, int stopCount, double bonus) {
        if (stopCount <= 0) {
            return 100.0 + bonus;
        }
        double baseline = stopCount * costModel.getBaselineKmPerStop();
        double excess = Math.max(0.0, distanceKm - baseline);
        return Math.max(0.0, 100.0 - (excess / baseline) * 50.0) + bonus;
    }

    /**
     * Reward for opening with the stop nearest the start, penalty otherwise.
     */
    public double adjacencyBonus(List<Stop> route) {
        if (route.isEmpty()) {
            return 0.0;
        }
        double firstDistance = originDistance(route.get(0));
        double minDistance = minOriginDistance(route);
        double gap = firstDistance - minDistance;
        if (gap <= costModel.getAdjacencyToleranceKm()) {
            return costModel.getAdjacencyReward();
        }
        return -Math.min(costModel.getAdjacencyPenaltyCap(), gap * costModel.getAdjacencyPenaltyPerKm());
    }

    /**
     * Whether the first stop is within tolerance of the nearest stop to the start.
     */
    public boolean opensWithNearestStop(List<Stop> route) {
        if (route.isEmpty()) {
            return true;
        }
        return originDistance(route.get(0)) - minOriginDistance(route) <= costModel.getAdjacencyToleranceKm();
    }

    /**
     * Index of the stop closest to the start; first one wins ties, -1 when empty.
     */
    public int nearestToStartIndex(List<Stop> stops) {
        int nearest = -1;
        double nearestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < stops.size(); i++) {
            double d = originDistance(stops.get(i));
            if (d < nearestDistance) {
                nearestDistance = d;
                nearest = i;
            }
        }
        return nearest;
    }

    public RouteScore score(List<Stop> route) {
        double distanceKm = routeDistance(route);
        return new RouteScore(distanceKm, fitness(distanceKm, route.size(), adjacencyBonus(route)));
    }

    /**
     * Driving time at the average speed plus handling time per stop, in hours.
     */
    public double estimatedTime(int stopCount, double distanceKm) {
        return distanceKm / costModel.getAverageSpeedKmh() + stopCount * costModel.getHandlingHoursPerStop();
    }

    public double fuelCost(double distanceKm) {
        return distanceKm / costModel.getFuelEfficiencyKmPerLiter() * costModel.getFuelPricePerLiter();
    }

    /**
     * Efficiency against the ideal per-stop distance, clamped to [0, 100].
     */
    public double optimizationScore(double distanceKm, int stopCount) {
        if (stopCount <= 0) {
            return 100.0;
        }
        double ideal = stopCount * costModel.getIdealKmPerStop();
        double efficiency = 1.0 - (distanceKm - ideal) / ideal;
        return Math.max(0.0, Math.min(100.0, efficiency * 100.0));
    }

    private double minOriginDistance(List<Stop> route) {
        double min = Double.POSITIVE_INFINITY;
        for (Stop stop : route) {
            min = Math.min(min, originDistance(stop));
        }
        return min;
    }
}
