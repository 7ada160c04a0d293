// =============================================================================
// DeliveryEase - Optimized Route
// =============================================================================
package com.deliveryease.optimizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Finished route plan returned to the caller.
 * Stops without coordinates are always at the tail, in input order.
 */
@Value
@Builder
public class OptimizedRoute {

    List<Stop> stops;
    double totalDistanceKm;
    double estimatedTimeHours;

    /**
     * Distance efficiency from 0 to 100.
     */
    double optimizationScore;

    double fuelCostEstimate;
    int generationCount;
    double fitnessScore;
    RouteStatus status;
    OriginType originType;
    ScheduleAssessment schedule;

    /**
     * Whether the searched route was reordered afterwards to open with the
     * stop nearest the start; the comparison still describes the route
     * before that move.
     */
    boolean nearestStopMovedToFront;

    /**
     * Present only for dual-route runs.
     */
    RouteComparison comparison;
}
