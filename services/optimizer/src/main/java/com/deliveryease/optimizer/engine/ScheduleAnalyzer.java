// =============================================================================
// DeliveryEase - Schedule Analyzer
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.ScheduleAssessment;
import com.deliveryease.optimizer.model.Stop;
import com.deliveryease.optimizer.model.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a finished route through the working day and reports how well it
 * honours time windows and priorities. Does not feed back into fitness.
 */
public class ScheduleAnalyzer {

    private static final int HIGH_PRIORITY_CUTOFF = 2;

    private final RouteCostModel costModel;

    public ScheduleAnalyzer(RouteCostModel costModel) {
        this.costModel = costModel;
    }

    public ScheduleAssessment assess(List<Stop> route) {
        double penalty = 0.0;
        double bonus = 0.0;
        List<String> late = new ArrayList<>();
        double clock = costModel.getScheduleStartHour();

        for (int i = 0; i < route.size(); i++) {
            Stop stop = route.get(i);
            TimeWindow window = stop.getTimeWindow();
            if (window != null) {
                if (clock < window.getStartHour()) {
                    penalty += (window.getStartHour() - clock) * costModel.getEarlyArrivalPenaltyPerHour();
                } else if (clock > window.getEndHour()) {
                    penalty += (clock - window.getEndHour()) * costModel.getLateArrivalPenaltyPerHour();
                    late.add(stop.getId());
                }
            }
            if (stop.getPriority() != null && stop.getPriority() <= HIGH_PRIORITY_CUTOFF) {
                bonus += (route.size() - i) * (HIGH_PRIORITY_CUTOFF + 1 - stop.getPriority());
            }
            clock += costModel.getHandlingHoursPerStop();
        }

        return ScheduleAssessment.builder()
                .timeWindowPenalty(penalty)
                .priorityBonus(bonus)
                .lateStopIds(List.copyOf(late))
                .build();
    }
}
