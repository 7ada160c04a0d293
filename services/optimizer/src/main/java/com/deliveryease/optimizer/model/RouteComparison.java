// =============================================================================
// DeliveryEase - Dual Route Comparison Record
// =============================================================================
package com.deliveryease.optimizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of running two independently configured searches and refining
 * between them. This record is the observable trace of a dual-route run.
 */
@Value
@Builder
public class RouteComparison {

    ParentRoute routeA;
    ParentRoute routeB;
    SelectedRoute selectedRoute;

    /**
     * Distance saved against the better parent, never negative.
     */
    double distanceImprovement;

    /**
     * Fitness of the selected route minus the better parent's fitness.
     */
    double fitnessImprovement;

    CrossoverSummary crossover;

    @Value
    @Builder
    public static class ParentRoute {
        List<Stop> stops;
        double totalDistanceKm;
        double fitnessScore;
        int generationCount;
    }

    @Value
    @Builder
    public static class CrossoverSummary {
        int iterations;
        double finalDistanceKm;
        double finalFitness;
        boolean improvedFromParents;
    }
}
