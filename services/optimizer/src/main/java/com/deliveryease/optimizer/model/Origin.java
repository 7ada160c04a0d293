// =============================================================================
// DeliveryEase - Route Origin
// =============================================================================
package com.deliveryease.optimizer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Start point of a route: either the depot or the driver's live position.
 */
@Value
@Builder
public class Origin {

    double latitude;
    double longitude;
    String name;
    String address;
    OriginType type;

    public static Origin depot(double latitude, double longitude, String name, String address) {
        return Origin.builder()
                .latitude(latitude)
                .longitude(longitude)
                .name(name)
                .address(address)
                .type(OriginType.DEPOT)
                .build();
    }

    public static Origin currentPosition(double latitude, double longitude) {
        return Origin.builder()
                .latitude(latitude)
                .longitude(longitude)
                .name("Current position")
                .type(OriginType.CURRENT_POSITION)
                .build();
    }
}
