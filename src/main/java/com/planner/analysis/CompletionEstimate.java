package com.planner.analysis;

import com.planner.core.Priority;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Projection of when the active tasks will be done.
 *
 * @param totalMinutes        Sum of estimates
 * @param adjustedMinutes     Estimates divided by the efficiency factor
 * @param daysNeeded          Adjusted minutes over daily capacity (1 decimal)
 * @param estimatedCompletion Projected completion date, null when there is nothing to do
 * @param minutesByPriority   Estimated minutes per tier
 */
public record CompletionEstimate(
        int totalMinutes,
        int adjustedMinutes,
        double daysNeeded,
        LocalDate estimatedCompletion,
        Map<Priority, Integer> minutesByPriority
) {
    public CompletionEstimate {
        minutesByPriority = Map.copyOf(minutesByPriority);
    }

    public Optional<LocalDate> getEstimatedCompletion() {
        return Optional.ofNullable(estimatedCompletion);
    }
}
