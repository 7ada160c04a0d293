// =============================================================================
// DeliveryEase - Search Termination Reason
// =============================================================================
package com.deliveryease.optimizer.engine;

public enum TerminationReason {
    /**
     * Best distance stopped moving for longer than the stagnation limit.
     */
    CONVERGED,
    GENERATION_LIMIT,
    CANCELLED
}
