// =============================================================================
// DeliveryEase - Genetic Search Result
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Stop;
import lombok.Value;

import java.util.List;

/**
 * Fittest route of a finished search and how the search ended.
 */
@Value
public class SearchResult {
    List<Stop> route;
    int generationCount;
    double distanceKm;
    TerminationReason terminationReason;

    public boolean isCancelled() {
        return terminationReason == TerminationReason.CANCELLED;
    }
}
