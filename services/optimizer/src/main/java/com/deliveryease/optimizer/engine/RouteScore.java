// =============================================================================
// DeliveryEase - Route Score
// =============================================================================
package com.deliveryease.optimizer.engine;

import lombok.Value;

/**
 * Road distance and fitness of one candidate route.
 */
@Value
public class RouteScore {
    double distanceKm;
    double fitness;
}
