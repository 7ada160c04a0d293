// =============================================================================
// DeliveryEase - Route Plan Response DTO
// =============================================================================
package com.deliveryease.optimizer.dto;

import com.deliveryease.optimizer.model.OriginType;
import com.deliveryease.optimizer.model.RouteStatus;
import com.deliveryease.optimizer.model.SelectedRoute;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for route planning.
 */
@Data
@Builder
public class RoutePlanResponse {

    /**
     * Unique plan ID.
     */
    private String planId;

    /**
     * How the route was produced.
     */
    private RouteStatus status;

    /**
     * Whether the route was planned from the depot or the driver's position.
     */
    private OriginType originType;

    /**
     * Total road distance in kilometers, back to the depot.
     */
    private double totalDistanceKm;

    /**
     * Driving plus handling time in hours.
     */
    private double estimatedTimeHours;

    /**
     * Distance efficiency from 0 to 100.
     */
    private double optimizationScore;

    /**
     * Estimated fuel cost in local currency.
     */
    private double fuelCostEstimate;

    private double fitnessScore;

    /**
     * Stops in delivery order.
     */
    private List<RouteStop> stops;

    /**
     * Closing leg from the last geocoded stop back to the depot; null when no
     * stop has coordinates.
     */
    private RouteStop returnLeg;

    /**
     * Dual-route comparison, absent for single-route and trivial plans.
     */
    private Comparison comparison;

    private Schedule schedule;

    /**
     * Solver statistics.
     */
    private SolverStats solverStats;

    /**
     * Timestamp.
     */
    private Instant timestamp;

    /**
     * A stop on the route.
     */
    @Data
    @Builder
    public static class RouteStop {

        private int sequence;
        private String stopId;
        private String orderId;
        private String customerName;
        private String address;
        private String barangay;
        private Double latitude;
        private Double longitude;
        private Integer priority;
        private boolean geocoded;

        /**
         * Road distance from the previous stop; null for stops without coordinates.
         */
        private Double distanceFromPreviousKm;
        private Double arrivalTimeHours;
        private Double departureTimeHours;
    }

    /**
     * Dual-route comparison summary.
     */
    @Data
    @Builder
    public static class Comparison {

        private ParentSummary routeA;
        private ParentSummary routeB;
        private SelectedRoute selectedRoute;
        private double distanceImprovementKm;
        private double fitnessImprovement;
        private int crossoverIterations;
        private double crossoverFinalDistanceKm;
        private double crossoverFinalFitness;
        private boolean improvedFromParents;
    }

    /**
     * One parent route of a dual-route run.
     */
    @Data
    @Builder
    public static class ParentSummary {

        private List<String> stopIds;
        private double totalDistanceKm;
        private double fitnessScore;
        private int generationCount;
    }

    /**
     * Time-window and priority diagnostics.
     */
    @Data
    @Builder
    public static class Schedule {

        private double timeWindowPenalty;
        private double priorityBonus;
        private List<String> lateStopIds;
    }

    /**
     * Solver statistics.
     */
    @Data
    @Builder
    public static class SolverStats {

        private long solveTimeMs;
        private int generations;
        private String algorithm;

        /**
         * True when the searched route was reordered to open with the stop
         * nearest the start after the parents were compared.
         */
        private boolean nearestStopMovedToFront;
    }
}
