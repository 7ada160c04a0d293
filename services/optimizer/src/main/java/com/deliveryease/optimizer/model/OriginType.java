// =============================================================================
// DeliveryEase - Route Origin Type
// =============================================================================
package com.deliveryease.optimizer.model;

/**
 * Planning context of a route.
 */
public enum OriginType {
    /**
     * Round trip from the depot, planned before departure.
     */
    DEPOT,
    /**
     * In-flight re-plan from the driver's live position, returning to the depot.
     */
    CURRENT_POSITION
}
