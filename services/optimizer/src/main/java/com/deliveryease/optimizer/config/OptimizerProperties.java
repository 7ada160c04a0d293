// =============================================================================
// DeliveryEase - Optimizer Configuration Properties
// =============================================================================
package com.deliveryease.optimizer.config;

import com.deliveryease.optimizer.engine.AlgorithmConfig;
import com.deliveryease.optimizer.engine.RouteCostModel;
import com.deliveryease.optimizer.model.Origin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the optimizer service.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    /**
     * Time limit for one optimization in milliseconds; 0 disables it.
     */
    private long timeLimitMs = 30000;

    /**
     * Maximum number of stops per request.
     */
    private int maxStops = 200;

    /**
     * Run the two dual-route searches on separate threads.
     */
    private boolean parallelParents = true;

    private Depot depot = new Depot();

    private Algorithm algorithm = new Algorithm();

    private Cost cost = new Cost();

    /**
     * Depot every route returns to.
     */
    @Data
    public static class Depot {
        private double latitude = 8.4542;
        private double longitude = 124.6319;
        private String name = "DeliveryEase Depot";
        private String address = "Cagayan de Oro City, Philippines";
    }

    /**
     * Default genetic algorithm parameters; requests may override them.
     */
    @Data
    public static class Algorithm {
        private int populationSize = 100;
        private int maxGenerations = 500;
        private double mutationRate = 0.02;
        private double crossoverRate = 1.0;
        private int eliteCount = 10;
        private double convergenceThreshold = 0.001;
        private boolean dualRouteComparison = true;
        private int stagnationLimit = 50;
        private int tournamentSize = 5;
        private int refinementIterations = 10;

        /**
         * Fixed seed for reproducible plans; random when unset.
         */
        private Long randomSeed;
    }

    /**
     * Distance, time and cost constants.
     */
    @Data
    public static class Cost {
        private double roadFactor = 1.2;
        private double avgSpeedKmh = 30;
        private double handlingHoursPerStop = 0.33;
        private double fuelEfficiencyKmPerLiter = 10;
        private double fuelPricePerLiter = 60;
        private double baselineKmPerStop = 1.5;
        private double idealKmPerStop = 2.0;
        private double adjacencyToleranceKm = 0.1;
        private double adjacencyReward = 50;
        private double scheduleStartHour = 9;
    }

    public Origin toDepot() {
        return Origin.depot(depot.getLatitude(), depot.getLongitude(), depot.getName(), depot.getAddress());
    }

    public AlgorithmConfig toAlgorithmConfig() {
        return AlgorithmConfig.builder()
                .populationSize(algorithm.getPopulationSize())
                .maxGenerations(algorithm.getMaxGenerations())
                .mutationRate(algorithm.getMutationRate())
                .crossoverRate(algorithm.getCrossoverRate())
                .eliteCount(algorithm.getEliteCount())
                .convergenceThreshold(algorithm.getConvergenceThreshold())
                .dualRouteComparison(algorithm.isDualRouteComparison())
                .stagnationLimit(algorithm.getStagnationLimit())
                .tournamentSize(algorithm.getTournamentSize())
                .refinementIterations(algorithm.getRefinementIterations())
                .randomSeed(algorithm.getRandomSeed())
                .build();
    }

    public RouteCostModel toCostModel() {
        return RouteCostModel.builder()
                .roadFactor(cost.getRoadFactor())
                .averageSpeedKmh(cost.getAvgSpeedKmh())
                .handlingHoursPerStop(cost.getHandlingHoursPerStop())
                .fuelEfficiencyKmPerLiter(cost.getFuelEfficiencyKmPerLiter())
                .fuelPricePerLiter(cost.getFuelPricePerLiter())
                .baselineKmPerStop(cost.getBaselineKmPerStop())
                .idealKmPerStop(cost.getIdealKmPerStop())
                .adjacencyToleranceKm(cost.getAdjacencyToleranceKm())
                .adjacencyReward(cost.getAdjacencyReward())
                .scheduleStartHour(cost.getScheduleStartHour())
                .build();
    }
}
