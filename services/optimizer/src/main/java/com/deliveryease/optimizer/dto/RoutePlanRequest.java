// =============================================================================
// DeliveryEase - Route Plan Request DTO
// =============================================================================
package com.deliveryease.optimizer.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;

import java.util.List;

/**
 * Request DTO for route planning.
 */
@Data
public class RoutePlanRequest {

    /**
     * Stops of the delivery batch, in the order the batch lists them.
     */
    @NotNull(message = "Stops are required")
    @Size(max = 500, message = "At most 500 stops per request")
    @Valid
    private List<StopRequest> stops;

    /**
     * Depot override; the configured depot is used when absent.
     */
    @Valid
    private Location depot;

    /**
     * Driver's live position, required for current-position planning.
     */
    @Valid
    private Location currentPosition;

    /**
     * Per-call overrides of the configured algorithm parameters.
     */
    @Valid
    private AlgorithmOverrides algorithm;

    /**
     * Delivery stop data.
     */
    @Data
    public static class StopRequest {

        @NotBlank(message = "Stop ID is required")
        private String id;

        private String orderId;

        private String customerName;

        private String address;

        private String barangay;

        /**
         * Optional; stops without coordinates are appended to the route tail.
         */
        @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
        @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
        private Double latitude;

        @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
        @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
        private Double longitude;

        private String phone;

        @PositiveOrZero(message = "Total cannot be negative")
        private double total;

        private String deliveryStatus;

        /**
         * Priority from 1 (highest) to 5 (lowest).
         */
        @Min(value = 1, message = "Priority must be between 1 and 5")
        @Max(value = 5, message = "Priority must be between 1 and 5")
        private Integer priority;

        @Valid
        private TimeWindowRequest timeWindow;
    }

    /**
     * Delivery window in hours of the day.
     */
    @Data
    public static class TimeWindowRequest {

        @Min(value = 0, message = "Start hour must be >= 0")
        @Max(value = 24, message = "Start hour must be <= 24")
        private int startHour;

        @Min(value = 0, message = "End hour must be >= 0")
        @Max(value = 24, message = "End hour must be <= 24")
        private int endHour;
    }

    /**
     * Location data for the depot or the driver.
     */
    @Data
    public static class Location {

        @NotNull(message = "Latitude is required")
        @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
        @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
        private Double latitude;

        @NotNull(message = "Longitude is required")
        @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
        @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
        private Double longitude;

        private String name;

        private String address;
    }

    /**
     * Algorithm parameters; unset fields keep their configured value.
     */
    @Data
    public static class AlgorithmOverrides {

        @Min(value = 2, message = "Population size must be at least 2")
        @Max(value = 2000, message = "Population size cannot exceed 2000")
        private Integer populationSize;

        @Min(value = 0, message = "Max generations cannot be negative")
        @Max(value = 10000, message = "Max generations cannot exceed 10000")
        private Integer maxGenerations;

        @DecimalMin(value = "0.0", message = "Mutation rate must be >= 0")
        @DecimalMax(value = "1.0", message = "Mutation rate must be <= 1")
        private Double mutationRate;

        @DecimalMin(value = "0.0", message = "Crossover rate must be >= 0")
        @DecimalMax(value = "1.0", message = "Crossover rate must be <= 1")
        private Double crossoverRate;

        @Min(value = 0, message = "Elite count cannot be negative")
        private Integer eliteCount;

        @DecimalMin(value = "0.0", message = "Convergence threshold cannot be negative")
        private Double convergenceThreshold;

        private Boolean dualRouteComparison;

        private Long randomSeed;
    }
}
