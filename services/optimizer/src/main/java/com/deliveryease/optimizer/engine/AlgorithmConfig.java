// =============================================================================
// DeliveryEase - Genetic Algorithm Configuration
// =============================================================================
package com.deliveryease.optimizer.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable parameters of one genetic search.
 * Every field has a default and can be overridden per call.
 */
@Value
@Builder(toBuilder = true)
public class AlgorithmConfig {

    @Builder.Default
    int populationSize = 100;

    @Builder.Default
    int maxGenerations = 500;

    @Builder.Default
    double mutationRate = 0.02;

    @Builder.Default
    double crossoverRate = 1.0;

    @Builder.Default
    int eliteCount = 10;

    /**
     * Smallest change of the best distance (km) that counts as progress.
     */
    @Builder.Default
    double convergenceThreshold = 0.001;

    @Builder.Default
    boolean dualRouteComparison = true;

    /**
     * Generations without progress tolerated before the search stops.
     */
    @Builder.Default
    int stagnationLimit = 50;

    @Builder.Default
    int tournamentSize = 5;

    /**
     * Crossover passes between the two parents of a dual-route run.
     */
    @Builder.Default
    int refinementIterations = 10;

    /**
     * Label for the seeded-shuffle seeding strategy; none when null.
     */
    String seedLabel;

    /**
     * Seed of the run's random generator; a fresh seed is drawn when null.
     */
    Long randomSeed;

    public static AlgorithmConfig defaults() {
        return AlgorithmConfig.builder().build();
    }

    /**
     * Checks every field against its allowed range.
     *
     * @throws RouteOptimizationException on the first violation
     */
    public AlgorithmConfig validate() {
        require(populationSize >= 2, "populationSize must be >= 2, got " + populationSize);
        require(maxGenerations >= 0, "maxGenerations must be >= 0, got " + maxGenerations);
        require(isRate(mutationRate), "mutationRate must be within [0, 1], got " + mutationRate);
        require(isRate(crossoverRate), "crossoverRate must be within [0, 1], got " + crossoverRate);
        require(eliteCount >= 0 && eliteCount <= populationSize,
                "eliteCount must be within [0, populationSize], got " + eliteCount);
        require(Double.isFinite(convergenceThreshold) && convergenceThreshold >= 0,
                "convergenceThreshold must be >= 0, got " + convergenceThreshold);
        require(stagnationLimit >= 0, "stagnationLimit must be >= 0, got " + stagnationLimit);
        require(tournamentSize >= 1, "tournamentSize must be >= 1, got " + tournamentSize);
        require(refinementIterations >= 0,
                "refinementIterations must be >= 0, got " + refinementIterations);
        return this;
    }

    private static boolean isRate(double value) {
        return Double.isFinite(value) && value >= 0.0 && value <= 1.0;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new RouteOptimizationException(RouteOptimizationException.REASON_INVALID_CONFIG, message);
        }
    }
}
