// =============================================================================
// DeliveryEase - Delivery Stop
// =============================================================================
package com.deliveryease.optimizer.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single delivery location handed to the optimizer.
 * Coordinates are optional; a stop without them is carried through
 * optimization but never takes part in distance math.
 */
@Value
@Builder(toBuilder = true)
public class Stop {

    /**
     * Priority assumed for stops that do not carry one.
     */
    public static final int DEFAULT_PRIORITY = 3;

    String id;
    String orderId;
    String customerName;
    String address;

    /**
     * Administrative area (barangay) the stop belongs to.
     */
    String barangay;

    Double latitude;
    Double longitude;
    String phone;
    double total;
    String deliveryStatus;

    /**
     * Priority rank, 1 highest to 5 lowest.
     */
    Integer priority;

    TimeWindow timeWindow;

    /**
     * Whether both coordinates are present and finite.
     */
    public boolean hasCoordinates() {
        return latitude != null && longitude != null
                && Double.isFinite(latitude) && Double.isFinite(longitude);
    }

    public int effectivePriority() {
        return priority != null ? priority : DEFAULT_PRIORITY;
    }
}
