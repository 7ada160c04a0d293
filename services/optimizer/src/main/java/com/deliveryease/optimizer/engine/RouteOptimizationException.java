// =============================================================================
// DeliveryEase - Route Optimization Exception
// =============================================================================
package com.deliveryease.optimizer.engine;

import lombok.Getter;

import java.util.Objects;

/**
 * Contract failure raised by the optimizer, carrying a stable reason code.
 */
@Getter
public class RouteOptimizationException extends RuntimeException {

    public static final String REASON_STOPS_REQUIRED = "STOPS_REQUIRED";
    public static final String REASON_STOP_REQUIRED = "STOP_REQUIRED";
    public static final String REASON_STOP_ID_REQUIRED = "STOP_ID_REQUIRED";
    public static final String REASON_DUPLICATE_STOP_ID = "DUPLICATE_STOP_ID";
    public static final String REASON_ORIGIN_REQUIRED = "ORIGIN_REQUIRED";
    public static final String REASON_INVALID_CONFIG = "INVALID_ALGORITHM_CONFIG";
    public static final String REASON_TOO_MANY_STOPS = "TOO_MANY_STOPS";
    public static final String REASON_SEARCH_FAILED = "SEARCH_FAILED";

    private final String reasonCode;

    public RouteOptimizationException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] " + message);
        this.reasonCode = reasonCode;
    }

    public RouteOptimizationException(String reasonCode, String message, Throwable cause) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] " + message, cause);
        this.reasonCode = reasonCode;
    }
}
