package com.planner.core;

import java.util.Objects;

/**
 * A task annotated with the time granted to it by one scheduling call.
 *
 * @param task                    Source task (unchanged)
 * @param allocatedMinutes        Minutes granted, never more than the estimate
 * @param scheduleOrder           1-based position in the schedule
 * @param recommendedBreakMinutes Break to take after working on this task
 * @param breakSuggestion         Human-readable break idea
 */
public record ScheduledTask(
        Task task,
        int allocatedMinutes,
        int scheduleOrder,
        int recommendedBreakMinutes,
        String breakSuggestion
) {
    public ScheduledTask {
        Objects.requireNonNull(task, "task cannot be null");
        if (allocatedMinutes <= 0 || allocatedMinutes > task.getEstimatedMinutes()) {
            throw new IllegalArgumentException("Allocated time " + allocatedMinutes
                    + " out of range for task '" + task.getTitle() + "' (" + task.getEstimatedMinutes() + " min)");
        }
        if (scheduleOrder < 1) {
            throw new IllegalArgumentException("Schedule order is 1-based, got " + scheduleOrder);
        }
    }

    public String title() {
        return task.getTitle();
    }

    public Priority priority() {
        return task.getPriority();
    }

    public int remainingMinutes() {
        return task.getEstimatedMinutes() - allocatedMinutes;
    }

    public boolean isPartial() {
        return allocatedMinutes < task.getEstimatedMinutes();
    }

    /**
     * Share of the estimate covered by this allocation, rounded to one decimal.
     */
    public double completionPercentage() {
        double pct = allocatedMinutes * 100.0 / task.getEstimatedMinutes();
        return Math.min(100.0, Math.round(pct * 10.0) / 10.0);
    }
}
