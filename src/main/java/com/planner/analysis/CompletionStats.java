package com.planner.analysis;

import com.planner.core.Priority;

import java.util.Map;

/**
 * Statistics over completed tasks.
 *
 * @param totalCompleted       Number of completed tasks
 * @param totalMinutesSpent    Actual minutes, falling back to the estimate
 * @param averageMinutesPerTask Average minutes per completed task
 * @param completedByPriority  Completed count per tier
 * @param productivityScore    0..100
 */
public record CompletionStats(
        int totalCompleted,
        int totalMinutesSpent,
        double averageMinutesPerTask,
        Map<Priority, Integer> completedByPriority,
        double productivityScore
) {
    public CompletionStats {
        completedByPriority = Map.copyOf(completedByPriority);
    }
}
