// =============================================================================
// DeliveryEase - Route Status
// =============================================================================
package com.deliveryease.optimizer.model;

/**
 * How an {@link OptimizedRoute} was produced.
 */
public enum RouteStatus {
    OPTIMIZED,
    TRIVIAL,
    FALLBACK,
    INTERRUPTED
}
