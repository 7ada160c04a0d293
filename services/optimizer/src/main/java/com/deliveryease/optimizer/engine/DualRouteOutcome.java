// =============================================================================
// DeliveryEase - Dual Route Outcome
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.RouteComparison;
import com.deliveryease.optimizer.model.Stop;
import lombok.Value;

import java.util.List;

/**
 * Winning route of a dual-route run together with its comparison record.
 */
@Value
public class DualRouteOutcome {
    List<Stop> route;
    double distanceKm;
    double fitness;
    int generationCount;
    RouteComparison comparison;

    /**
     * Whether either parent search was stopped by cancellation.
     */
    boolean interrupted;
}
