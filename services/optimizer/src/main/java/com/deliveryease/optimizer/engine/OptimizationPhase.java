// =============================================================================
// DeliveryEase - Optimization Phase
// =============================================================================
package com.deliveryease.optimizer.engine;

/**
 * Steps of one optimizer call, in order.
 */
enum OptimizationPhase {
    SEEDING,
    EVOLVING,
    DUAL_COMPARING,
    EVALUATING,
    DONE
}
