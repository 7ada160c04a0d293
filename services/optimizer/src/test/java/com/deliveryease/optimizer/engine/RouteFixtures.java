// =============================================================================
// DeliveryEase - Engine Test Fixtures
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Origin;
import com.deliveryease.optimizer.model.Stop;

/**
 * Small stop sets with known geometry.
 * <p>
 * The square sits on the equator so a hundredth of a degree is the same
 * length along both axes: the depot is one corner and A, B, C the others,
 * so the perimeter A-B-C (or C-B-A) is the only shortest tour.
 */
final class RouteFixtures {

    static final Origin EQUATOR_DEPOT = Origin.depot(0.0, 0.0, "Equator depot", null);
    static final Origin CDO_DEPOT = Origin.depot(8.4850, 124.6500, "Cagayan de Oro depot", null);

    private RouteFixtures() {
    }

    static Stop stop(String id, double latitude, double longitude) {
        return Stop.builder().id(id).latitude(latitude).longitude(longitude).build();
    }

    static Stop ungeocoded(String id) {
        return Stop.builder().id(id).build();
    }

    static Stop squareA() {
        return stop("A", 0.01, 0.0);
    }

    static Stop squareB() {
        return stop("B", 0.01, 0.01);
    }

    static Stop squareC() {
        return stop("C", 0.0, 0.01);
    }

    static AlgorithmConfig smallConfig(long seed) {
        return AlgorithmConfig.builder()
                .populationSize(30)
                .maxGenerations(100)
                .eliteCount(3)
                .randomSeed(seed)
                .build();
    }
}
