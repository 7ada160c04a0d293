// =============================================================================
// DeliveryEase - Service Time Window
// =============================================================================
package com.deliveryease.optimizer.model;

import lombok.Value;

/**
 * Preferred delivery window in hours of the day, e.g. 9 to 17.
 */
@Value
public class TimeWindow {
    int startHour;
    int endHour;
}
