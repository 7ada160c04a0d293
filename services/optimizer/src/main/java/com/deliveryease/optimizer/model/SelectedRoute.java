// =============================================================================
// DeliveryEase - Dual Route Selection
// =============================================================================
package com.deliveryease.optimizer.model;

public enum SelectedRoute {
    A,
    B,
    CROSSOVER
}
