// =============================================================================
// DeliveryEase - Great-Circle Distance
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Origin;
import com.deliveryease.optimizer.model.Stop;

/**
 * Straight-line distances between stops and origins.
 * Pairs involving a stop without coordinates get a fixed penalty distance
 * instead of an error, so such stops sink in every ranking.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private final double missingCoordinatePenaltyKm;

    public GeoDistance(double missingCoordinatePenaltyKm) {
        this.missingCoordinatePenaltyKm = missingCoordinatePenaltyKm;
    }

    /**
     * Distance between two stops in km.
     */
    public double between(Stop from, Stop to) {
        if (!from.hasCoordinates() || !to.hasCoordinates()) {
            return missingCoordinatePenaltyKm;
        }
        return haversineKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }

    /**
     * Distance between a stop and an origin in km.
     */
    public double toOrigin(Stop stop, Origin origin) {
        if (!stop.hasCoordinates()) {
            return missingCoordinatePenaltyKm;
        }
        return haversineKm(origin.getLatitude(), origin.getLongitude(), stop.getLatitude(), stop.getLongitude());
    }

    /**
     * Haversine distance between two points.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                   Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                   Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }
}
