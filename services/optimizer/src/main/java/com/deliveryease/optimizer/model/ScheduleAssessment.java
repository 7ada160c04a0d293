// =============================================================================
// DeliveryEase - Schedule Assessment
// =============================================================================
package com.deliveryease.optimizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Time-window and priority diagnostics for a finished route.
 */
@Value
@Builder
public class ScheduleAssessment {

    /**
     * Accumulated early-arrival and late-arrival penalty.
     */
    double timeWindowPenalty;

    /**
     * Reward for visiting high-priority stops early.
     */
    double priorityBonus;

    List<String> lateStopIds;
}
