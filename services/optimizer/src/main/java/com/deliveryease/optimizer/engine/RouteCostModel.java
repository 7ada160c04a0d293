// =============================================================================
// DeliveryEase - Route Cost Model
// =============================================================================
package com.deliveryease.optimizer.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Constants of the distance, fitness, time and cost formulas.
 */
@Value
@Builder(toBuilder = true)
public class RouteCostModel {

    /**
     * Road distance relative to straight-line distance, applied to route totals.
     */
    @Builder.Default
    double roadFactor = 1.2;

    /**
     * Distance charged for a leg touching a stop without coordinates.
     */
    @Builder.Default
    double missingCoordinatePenaltyKm = 1000.0;

    @Builder.Default
    double averageSpeedKmh = 30.0;

    @Builder.Default
    double handlingHoursPerStop = 0.33;

    @Builder.Default
    double fuelEfficiencyKmPerLiter = 10.0;

    @Builder.Default
    double fuelPricePerLiter = 60.0;

    /**
     * Expected distance per stop used as the fitness baseline.
     */
    @Builder.Default
    double baselineKmPerStop = 1.5;

    /**
     * Ideal distance per stop used by the optimization score.
     */
    @Builder.Default
    double idealKmPerStop = 2.0;

    @Builder.Default
    double adjacencyToleranceKm = 0.1;

    @Builder.Default
    double adjacencyReward = 50.0;

    @Builder.Default
    double adjacencyPenaltyPerKm = 10.0;

    @Builder.Default
    double adjacencyPenaltyCap = 30.0;

    @Builder.Default
    double fallbackKmPerStop = 3.0;

    @Builder.Default
    double fallbackHoursPerStop = 0.5;

    @Builder.Default
    double fallbackOptimizationScore = 60.0;

    @Builder.Default
    double scheduleStartHour = 9.0;

    @Builder.Default
    double earlyArrivalPenaltyPerHour = 10.0;

    @Builder.Default
    double lateArrivalPenaltyPerHour = 20.0;

    public static RouteCostModel defaults() {
        return RouteCostModel.builder().build();
    }
}
